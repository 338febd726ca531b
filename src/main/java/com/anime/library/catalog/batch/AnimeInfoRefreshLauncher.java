package com.anime.library.catalog.batch;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

@Component
public class AnimeInfoRefreshLauncher {
    private final JobLauncher jobLauncher;
    private final Job animeInfoRefreshJob;
    private final Duration maxAge;

    public AnimeInfoRefreshLauncher(JobLauncher jobLauncher,
                                    Job animeInfoRefreshJob,
                                    @Value("${app.info-refresh.max-age:P7D}") Duration maxAge) {
        this.jobLauncher = jobLauncher;
        this.animeInfoRefreshJob = animeInfoRefreshJob;
        this.maxAge = maxAge;
    }

    public JobExecution launchWithDefaultCutoff() throws Exception {
        return launch(LocalDateTime.now().minus(maxAge));
    }

    public JobExecution launch(LocalDateTime cutoff) throws Exception {
        JobParameters params = new JobParametersBuilder()
                .addString(AnimeInfoRefreshTasklet.CUTOFF_PARAMETER, cutoff.toString())
                .addLong("startedAt", System.currentTimeMillis())
                .toJobParameters();
        return jobLauncher.run(animeInfoRefreshJob, params);
    }
}
