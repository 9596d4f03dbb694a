package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class YuttoServiceTest {

    private SyncProperties properties;
    private YuttoService yuttoService;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        yuttoService = new YuttoService(properties);
        yuttoService.initializePath();
    }

    @Test
    void defaultsToYuttoOnPath() {
        assertThat(yuttoService.getYuttoPath()).isEqualTo("yutto");
    }

    @Test
    void singleVideoCommand() {
        properties.getCredential().setSessdata("secret");

        List<String> command = yuttoService.buildCommand("BV1xx", Path.of("/data/fav"), false, null);

        assertThat(command).containsExactly("yutto", "-d", "/data/fav", "--no-danmaku", "--no-subtitle",
                "--with-metadata", "--save-cover", "--no-color", "--no-progress", "-c", "secret",
                "https://www.bilibili.com/video/BV1xx");
    }

    @Test
    void batchCommandWithSubpathTemplate() {
        List<String> command = yuttoService.buildCommand("BV2", Path.of("out"), true, "{title}/{name}");

        assertThat(command).doesNotContain("-c")
                .containsSubsequence("--batch", "--subpath-template", "{title}/{name}")
                .endsWith("https://www.bilibili.com/video/BV2");
    }

    @Test
    void extraOptionsComeBeforeTheUrl() {
        properties.getYutto().setExtraOptions(List.of("--vcodec", "hevc:copy"));

        List<String> command = yuttoService.buildCommand("BV3", Path.of("out"), false, "");

        assertThat(command).doesNotContain("--subpath-template")
                .endsWith("--vcodec", "hevc:copy", "https://www.bilibili.com/video/BV3");
    }
}
