package com.maslen.favsync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.model.VideoInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Thin client for the Bilibili web API: favorite list contents, video details and
 * favorite list edits used by postprocess actions.
 */
@Slf4j
@Service
public class BilibiliClient {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    /** Resource type of a video inside a favorite list. */
    private static final int VIDEO_RESOURCE_TYPE = 2;

    private final SyncProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public BilibiliClient(SyncProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getRequestTimeout()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * All bvids of a favorite list, in the order the API returns them.
     */
    public List<String> listFavoriteIds(String fid) throws IOException, InterruptedException {
        JsonNode data = get("/x/v3/fav/resource/ids", Map.of("media_id", fid, "platform", "web"));
        List<String> bvids = new ArrayList<>();
        if (data == null || !data.isArray()) {
            return bvids;
        }
        for (JsonNode entry : data) {
            if (entry.path("type").asInt(VIDEO_RESOURCE_TYPE) != VIDEO_RESOURCE_TYPE) {
                continue;
            }
            String bvid = entry.path("bvid").asText(entry.path("bv_id").asText(""));
            if (!bvid.isEmpty()) {
                bvids.add(bvid);
            }
        }
        log.debug("[BILIBILI] Favorite list {} holds {} videos", fid, bvids.size());
        return bvids;
    }

    /**
     * Video details, empty when the video is no longer available.
     */
    public Optional<VideoInfo> getVideoInfo(String bvid) throws IOException, InterruptedException {
        JsonNode data;
        try {
            data = get("/x/web-interface/view", Map.of("bvid", bvid));
        } catch (BilibiliApiException e) {
            log.warn("[BILIBILI] Video {} is unavailable: {}", bvid, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new VideoInfo(
                bvid,
                data.path("aid").asLong(),
                data.path("title").asText(""),
                Math.max(1, data.path("videos").asInt(1))));
    }

    public void moveResource(String fromFid, String toFid, long aid) throws IOException, InterruptedException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("resources", aid + ":" + VIDEO_RESOURCE_TYPE);
        form.put("src_media_id", fromFid);
        form.put("tar_media_id", toFid);
        if (properties.getCredential().getDedeuserid() != null) {
            form.put("mid", properties.getCredential().getDedeuserid());
        }
        form.put("platform", "web");
        form.put("csrf", requireCsrf());
        post("/x/v3/fav/resource/move", form);
        log.debug("[BILIBILI] Moved video {} from {} to {}", aid, fromFid, toFid);
    }

    public void removeResource(String fid, long aid) throws IOException, InterruptedException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("resources", aid + ":" + VIDEO_RESOURCE_TYPE);
        form.put("media_id", fid);
        form.put("platform", "web");
        form.put("csrf", requireCsrf());
        post("/x/v3/fav/resource/batch-del", form);
        log.debug("[BILIBILI] Removed video {} from {}", aid, fid);
    }

    private JsonNode get(String endpoint, Map<String, String> query) throws IOException, InterruptedException {
        HttpRequest request = baseRequest(endpoint + "?" + encode(query)).GET().build();
        return send(endpoint, request);
    }

    private JsonNode post(String endpoint, Map<String, String> form) throws IOException, InterruptedException {
        HttpRequest request = baseRequest(endpoint)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
                .build();
        return send(endpoint, request);
    }

    private HttpRequest.Builder baseRequest(String pathAndQuery) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBilibili().getApiBase() + pathAndQuery))
                .timeout(Duration.ofSeconds(properties.getRequestTimeout()))
                .header("User-Agent", USER_AGENT)
                .header("Referer", "https://www.bilibili.com/");
        String cookie = cookieHeader();
        if (!cookie.isEmpty()) {
            builder.header("Cookie", cookie);
        }
        return builder;
    }

    private JsonNode send(String endpoint, HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("Bilibili API " + endpoint + " answered HTTP " + response.statusCode());
        }
        JsonNode root = objectMapper.readTree(response.body());
        int code = root.path("code").asInt(-1);
        if (code != 0) {
            throw new BilibiliApiException(endpoint, code, root.path("message").asText(""));
        }
        return root.path("data");
    }

    private String cookieHeader() {
        SyncProperties.Credential credential = properties.getCredential();
        StringJoiner cookie = new StringJoiner("; ");
        appendCookie(cookie, "SESSDATA", credential.getSessdata());
        appendCookie(cookie, "bili_jct", credential.getBiliJct());
        appendCookie(cookie, "buvid3", credential.getBuvid3());
        appendCookie(cookie, "DedeUserID", credential.getDedeuserid());
        appendCookie(cookie, "ac_time_value", credential.getAcTimeValue());
        return cookie.toString();
    }

    private static void appendCookie(StringJoiner cookie, String name, String value) {
        if (value != null && !value.isBlank()) {
            cookie.add(name + "=" + value);
        }
    }

    private String requireCsrf() throws IOException {
        String csrf = properties.getCredential().getBiliJct();
        if (csrf == null || csrf.isBlank()) {
            throw new IOException("favsync.credential.bili-jct is required to edit favorite lists");
        }
        return csrf;
    }

    private static String encode(Map<String, String> values) {
        StringJoiner joiner = new StringJoiner("&");
        values.forEach((name, value) -> joiner.add(URLEncoder.encode(name, StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return joiner.toString();
    }
}
