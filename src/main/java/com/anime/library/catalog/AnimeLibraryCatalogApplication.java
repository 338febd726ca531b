package com.anime.library.catalog;

import com.anime.library.catalog.batch.AnimeInfoRefreshLauncher;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AnimeLibraryCatalogApplication {

	public static void main(String[] args) {
		SpringApplication.run(AnimeLibraryCatalogApplication.class, args);
	}

	@Bean
	@Profile("refresh")
	CommandLineRunner runInfoRefreshOnce(AnimeInfoRefreshLauncher launcher) {
		return args -> launcher.launchWithDefaultCutoff();
	}
}
