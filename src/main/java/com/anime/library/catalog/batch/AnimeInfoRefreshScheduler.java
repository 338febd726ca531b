package com.anime.library.catalog.batch;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.info-refresh", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AnimeInfoRefreshScheduler {
    private final AnimeInfoRefreshLauncher launcher;

    public AnimeInfoRefreshScheduler(AnimeInfoRefreshLauncher launcher) {
        this.launcher = launcher;
    }

    @Scheduled(cron = "${app.info-refresh.cron:0 0 4 * * *}", zone = "${app.info-refresh.zone:UTC}")
    public void runInfoRefresh() throws Exception {
        launcher.launchWithDefaultCutoff();
    }
}
