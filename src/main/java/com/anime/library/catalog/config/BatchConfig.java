package com.anime.library.catalog.config;

import com.anime.library.catalog.batch.AnimeInfoRefreshTasklet;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BatchConfig {

    @Bean
    public Job animeInfoRefreshJob(JobRepository jobRepository, Step animeInfoRefreshStep) {
        return new JobBuilder("animeInfoRefreshJob", jobRepository)
                .start(animeInfoRefreshStep)
                .build();
    }

    // The refresh commits per site through its own transactions, so the step itself
    // must not hold a JPA transaction open around the whole scan.
    @Bean
    public Step animeInfoRefreshStep(JobRepository jobRepository, AnimeInfoRefreshTasklet tasklet) {
        return new StepBuilder("animeInfoRefreshStep", jobRepository)
                .tasklet(tasklet, new ResourcelessTransactionManager())
                .build();
    }
}
