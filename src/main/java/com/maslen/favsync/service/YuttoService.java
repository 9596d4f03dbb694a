package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the yutto downloader as a subprocess.
 */
@Slf4j
@Service
public class YuttoService {

    private final SyncProperties properties;

    private String yuttoPath;

    public YuttoService(SyncProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void initializePath() {
        yuttoPath = PathUtils.resolvePath(properties.getYutto().getPath(), "yutto");
        log.info("[YUTTO] Initialized path: {}", yuttoPath);
    }

    /**
     * Logs the yutto version; a missing binary is only reported since downloads will
     * fail and be retried on their own.
     */
    public void ensureAvailable() {
        try {
            Process process = new ProcessBuilder(yuttoPath, "--version").redirectErrorStream(true).start();
            String version;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                version = reader.readLine();
            }
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("[YUTTO] {} --version did not answer in time", yuttoPath);
                return;
            }
            log.info("[YUTTO] Using {} ({})", yuttoPath, version);
        } catch (IOException e) {
            log.warn("[YUTTO] {} is not available: {}", yuttoPath, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Downloads one video into {@code downloadDir}.
     *
     * @param batch           the video has several parts
     * @param subpathTemplate yutto subpath template, may be null
     */
    public void download(String bvid, Path downloadDir, boolean batch, String subpathTemplate)
            throws IOException, InterruptedException {
        Files.createDirectories(downloadDir);
        List<String> command = buildCommand(bvid, downloadDir, batch, subpathTemplate);
        log.info("[YUTTO] Start downloading {}", bvid);
        log.debug("[YUTTO] Run with command: {}", String.join(" ", redact(command)));
        executeCommand(bvid, command);
        log.info("[YUTTO] End downloaded {}", bvid);
    }

    List<String> buildCommand(String bvid, Path downloadDir, boolean batch, String subpathTemplate) {
        List<String> command = new ArrayList<>(List.of(
                yuttoPath,
                "-d", downloadDir.toString(),
                "--no-danmaku",
                "--no-subtitle",
                "--with-metadata",
                "--save-cover",
                "--no-color",
                "--no-progress"));
        String sessdata = properties.getCredential().getSessdata();
        if (sessdata != null && !sessdata.isBlank()) {
            command.add("-c");
            command.add(sessdata);
        } else {
            log.warn("[YUTTO] No sessdata configured, downloading {} anonymously", bvid);
        }
        if (batch) {
            command.add("--batch");
        }
        if (subpathTemplate != null && !subpathTemplate.isBlank()) {
            command.add("--subpath-template");
            command.add(subpathTemplate);
        }
        command.addAll(properties.getYutto().getExtraOptions());
        command.add(properties.getBilibili().getVideoUrlBase() + bvid);
        return command;
    }

    private void executeCommand(String bvid, List<String> command) throws IOException, InterruptedException {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        Process process = processBuilder.start();

        // waitFor() stays interruptible while the pump drains the output
        Thread pump = new Thread(() -> pumpOutput(process), "yutto-output-" + bvid);
        pump.setDaemon(true);
        pump.start();

        try {
            int exitCode = process.waitFor();
            pump.join(TimeUnit.SECONDS.toMillis(5));
            if (exitCode != 0) {
                throw new IOException("yutto exited with code " + exitCode + " for " + bvid);
            }
        } catch (InterruptedException e) {
            log.warn("[YUTTO] Download of {} interrupted, killing yutto", bvid);
            process.destroyForcibly();
            throw e;
        }
    }

    private void pumpOutput(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (properties.isVerbose()) {
                    log.info("[YUTTO] {}", line);
                } else {
                    log.debug("[YUTTO] {}", line);
                }
            }
        } catch (IOException e) {
            // stream closes when the process is killed
            log.debug("[YUTTO] Output stream closed: {}", e.getMessage());
        }
    }

    private static List<String> redact(List<String> command) {
        List<String> redacted = new ArrayList<>(command);
        int cookie = redacted.indexOf("-c");
        if (cookie >= 0 && cookie + 1 < redacted.size()) {
            redacted.set(cookie + 1, "***");
        }
        return redacted;
    }

    public String getYuttoPath() {
        return yuttoPath;
    }
}
