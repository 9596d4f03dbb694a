package com.maslen.favsync.runner;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.service.ConcurrencyLimiter;
import com.maslen.favsync.service.YuttoService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalToolsInitializer implements ApplicationRunner {

    private final YuttoService yuttoService;
    private final ConcurrencyLimiter limiter;
    private final SyncProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Checking yutto availability...");
        yuttoService.ensureAvailable();

        properties.getFavoriteList().forEach((name, list) -> log.info("Favorite list {} (fid {}) -> {}{}",
                name, list.getFid(), list.getPath(),
                list.actions().isEmpty() ? "" : ", postprocess " + list.actions()));
        log.info("Polling every {}s, {} concurrent tasks, task timeout {}s",
                properties.getInterval(), limiter.getMaxPermits(), properties.getTaskTimeout());
    }
}
