package com.anime.library.catalog.batch;

import com.anime.library.catalog.model.InfoRefreshReport;
import com.anime.library.catalog.service.info.AnimeInfoRefreshService;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

@Component
public class AnimeInfoRefreshTasklet implements Tasklet {
    public static final String CUTOFF_PARAMETER = "cutoff";
    public static final ExitStatus COMPLETED_WITH_FAILURES = new ExitStatus("COMPLETED_WITH_FAILURES");

    private final AnimeInfoRefreshService animeInfoRefreshService;
    private final Duration maxAge;

    public AnimeInfoRefreshTasklet(AnimeInfoRefreshService animeInfoRefreshService,
                                   @Value("${app.info-refresh.max-age:P7D}") Duration maxAge) {
        this.animeInfoRefreshService = animeInfoRefreshService;
        this.maxAge = maxAge;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        StepExecution stepExecution = chunkContext.getStepContext().getStepExecution();
        LocalDateTime cutoff = resolveCutoff(stepExecution.getJobParameters());

        InfoRefreshReport report = animeInfoRefreshService.updateAllInfo(cutoff);

        contribution.incrementWriteCount(report.refreshed());
        ExecutionContext context = stepExecution.getExecutionContext();
        context.putString(CUTOFF_PARAMETER, cutoff.toString());
        context.putInt("staleSites", report.staleSites());
        context.putInt("unsupported", report.unsupported());
        context.putInt("failed", report.failed());
        context.putInt("animeTouched", report.animeTouched());
        if (report.failed() > 0) {
            contribution.setExitStatus(COMPLETED_WITH_FAILURES);
        }
        return RepeatStatus.FINISHED;
    }

    private LocalDateTime resolveCutoff(JobParameters parameters) {
        String cutoff = parameters.getString(CUTOFF_PARAMETER);
        if (cutoff == null || cutoff.isBlank()) {
            return LocalDateTime.now().minus(maxAge);
        }
        return LocalDateTime.parse(cutoff);
    }
}
