package com.maslen.favsync.config;

import com.maslen.favsync.model.MoveAction;
import com.maslen.favsync.model.PostprocessAction;
import com.maslen.favsync.model.RemoveAction;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings under the {@code favsync} prefix.
 */
@Data
@ConfigurationProperties(prefix = "favsync")
public class SyncProperties implements InitializingBean {

    /** Favorite list entry that receives API submissions and is never polled. */
    public static final String NO_FAVORITE = "-1";

    private static final String DEFAULT_SYNC_PATH = "sync/";

    /** Seconds between two producer cycles. */
    private long interval = 1200;

    /** Milliseconds between two consumer polls. */
    private long consumerPoll = 1000;

    /** Milliseconds the consumer waits after a failed poll. */
    private long consumerErrorBackoff = 5000;

    /** Seconds before a catalog request gives up. */
    private long requestTimeout = 300;

    private int maxConcurrentTasks = 3;

    /** Seconds a single task may run before it is failed. */
    private long taskTimeout = 600;

    private boolean verbose = false;

    private Yutto yutto = new Yutto();

    private Bilibili bilibili = new Bilibili();

    private Credential credential = new Credential();

    private Map<String, FavoriteList> favoriteList = new LinkedHashMap<>();

    private Retry retry = new Retry();

    private Reconcile reconcile = new Reconcile();

    @Override
    public void afterPropertiesSet() {
        if (maxConcurrentTasks < 1) {
            throw new IllegalStateException("favsync.max-concurrent-tasks must be at least 1, got " + maxConcurrentTasks);
        }
        if (taskTimeout < 1) {
            throw new IllegalStateException("favsync.task-timeout must be at least 1 second, got " + taskTimeout);
        }
        if (!favoriteList.containsKey(NO_FAVORITE)) {
            FavoriteList api = new FavoriteList();
            api.setFid(NO_FAVORITE);
            api.setPath(DEFAULT_SYNC_PATH);
            Map<String, FavoriteList> lists = new LinkedHashMap<>();
            lists.put(NO_FAVORITE, api);
            lists.putAll(favoriteList);
            favoriteList = lists;
        }
        favoriteList.forEach((name, list) -> {
            if (list.getFid() == null || list.getFid().isBlank()) {
                // simple form: the entry name is the fid
                list.setFid(name);
            }
            if (list.getPath() == null || list.getPath().isBlank()) {
                throw new IllegalStateException("favsync.favorite-list." + name + ".path is required");
            }
            // resolve once so configuration errors fail the startup
            list.actions();
        });
    }

    /**
     * Favorite list configuration for a task name, falling back to the API entry
     * when the name is no longer configured.
     */
    public FavoriteList favoriteListOrDefault(String name) {
        FavoriteList list = favoriteList.get(name);
        return list != null ? list : favoriteList.get(NO_FAVORITE);
    }

    /** Favorite lists the producer polls, keyed by task name. */
    public Map<String, FavoriteList> polledFavoriteLists() {
        Map<String, FavoriteList> polled = new LinkedHashMap<>();
        favoriteList.forEach((name, list) -> {
            if (!isSentinel(list.getFid())) {
                polled.put(name, list);
            }
        });
        return polled;
    }

    static boolean isSentinel(String fid) {
        if (fid == null) {
            return true;
        }
        try {
            return Long.parseLong(fid.trim()) < 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Data
    public static class Yutto {
        /** Executable; {@code yutto} from PATH when empty. */
        private String path = "";
        private List<String> extraOptions = new ArrayList<>();
    }

    @Data
    public static class Bilibili {
        private String apiBase = "https://api.bilibili.com";
        private String videoUrlBase = "https://www.bilibili.com/video/";
    }

    @Data
    public static class Credential {
        private String sessdata;
        private String biliJct;
        private String buvid3;
        private String dedeuserid;
        private String acTimeValue;
    }

    @Data
    public static class FavoriteList {
        private String fid;
        /** Destination directory template, may contain {YYYY}, {MM}, ... placeholders. */
        private String path;
        /** Optional yutto subpath template. */
        private String name;
        private List<Postprocess> postprocess = new ArrayList<>();

        public List<PostprocessAction> actions() {
            List<PostprocessAction> actions = new ArrayList<>();
            if (postprocess == null) {
                return actions;
            }
            for (Postprocess entry : postprocess) {
                actions.add(entry.toAction());
            }
            return actions;
        }
    }

    @Data
    public static class Postprocess {
        private String action;
        private String fid;

        public PostprocessAction toAction() {
            String name = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
            return switch (name) {
                case "move" -> {
                    if (fid == null || fid.isBlank()) {
                        throw new IllegalStateException("Postprocess action 'move' requires a target fid");
                    }
                    yield new MoveAction(fid.trim());
                }
                case "remove" -> new RemoveAction();
                default -> throw new IllegalStateException("Unknown postprocess action: " + action);
            };
        }
    }

    @Data
    public static class Retry {
        /** 0 retries forever. */
        private int maxAttempts = 10;
        /** Seconds before the first retry, doubled for every further attempt. */
        private long backoff = 60;
        private long maxBackoff = 21600;
    }

    @Data
    public static class Reconcile {
        private boolean enabled = true;
        /** Seconds between two sweeps. */
        private long interval = 300;
        private boolean recoverStuckExecuting = true;
        /** Seconds an EXECUTING row may go without update; 0 means twice the task timeout. */
        private long stuckAfter = 0;
        private boolean pruneMissingFromCatalog = false;
        private boolean pruneDownloaded = false;
    }
}
