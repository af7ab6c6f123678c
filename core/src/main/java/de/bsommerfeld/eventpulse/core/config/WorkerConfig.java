package de.bsommerfeld.eventpulse.core.config;

import de.bsommerfeld.eventpulse.core.util.DataDirectories;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable worker settings resolved once at startup from environment
 * variables. A JVM system property with the same name takes precedence over
 * the environment, which keeps local runs and tests free of shell setup.
 *
 * <p>
 * Every setting has a default except the credentials. In {@link ApplicationMode#PROD}
 * a missing credential is fatal: {@link #load} collects all missing and
 * malformed variables and throws a single {@link ConfigurationException}
 * naming them.
 */
public final class WorkerConfig {

    public static final String APP_NAME = "event-pulse";

    static final String STORAGE_URL = "STORAGE_URL";
    static final String STORAGE_KEY = "STORAGE_KEY";
    static final String STORAGE_USER = "STORAGE_USER";
    static final String REDDIT_CLIENT_ID = "REDDIT_CLIENT_ID";
    static final String REDDIT_CLIENT_SECRET = "REDDIT_CLIENT_SECRET";
    static final String REDDIT_USER_AGENT = "REDDIT_USER_AGENT";
    static final String REDDIT_POLL_SECONDS = "REDDIT_POLL_SECONDS";
    static final String REDDIT_MAX_POSTS = "REDDIT_MAX_POSTS";
    static final String REDDIT_MAX_COMMENTS = "REDDIT_MAX_COMMENTS";
    static final String REDDIT_SEARCH_FALLBACK = "REDDIT_SEARCH_FALLBACK";
    static final String JOB_BATCH_SIZE = "JOB_BATCH_SIZE";
    static final String JOB_MAX_ATTEMPTS = "JOB_MAX_ATTEMPTS";
    static final String WORKER_MODE = "WORKER_MODE";
    static final String EVENT_STATUSES = "EVENT_STATUSES";
    static final String REQUEST_TIMEOUT_SECONDS = "REQUEST_TIMEOUT_SECONDS";
    static final String POLL_JITTER_CAP_SECONDS = "POLL_JITTER_CAP_SECONDS";

    static final String DEFAULT_USER_AGENT = "campus-events-app/0.1";

    private final ApplicationMode applicationMode;
    private final WorkerMode workerMode;
    private final String storageUrl;
    private final String storageKey;
    private final String storageUser;
    private final String redditClientId;
    private final String redditClientSecret;
    private final String userAgent;
    private final Duration pollInterval;
    private final int maxPostsPerTarget;
    private final int maxCommentsPerPost;
    private final boolean searchFallback;
    private final int jobBatchSize;
    private final int maxAttempts;
    private final List<String> eventStatuses;
    private final Duration requestTimeout;
    private final Duration jitterCap;

    private WorkerConfig(Parser p) {
        this.applicationMode = p.mode;
        this.workerMode = p.enumValue(WORKER_MODE, WorkerMode.class, WorkerMode.QUEUE);
        this.storageUrl = p.storageUrl(STORAGE_URL, defaultStorageUrl());
        this.storageKey = p.required(STORAGE_KEY);
        this.storageUser = p.string(STORAGE_USER, null);
        this.redditClientId = p.required(REDDIT_CLIENT_ID);
        this.redditClientSecret = p.required(REDDIT_CLIENT_SECRET);
        this.userAgent = p.string(REDDIT_USER_AGENT, DEFAULT_USER_AGENT);
        this.pollInterval = Duration.ofSeconds(p.integer(REDDIT_POLL_SECONDS, 300, 1));
        this.maxPostsPerTarget = p.integer(REDDIT_MAX_POSTS, 20, 1);
        this.maxCommentsPerPost = p.integer(REDDIT_MAX_COMMENTS, 50, 0);
        this.searchFallback = p.bool(REDDIT_SEARCH_FALLBACK, false);
        this.jobBatchSize = p.integer(JOB_BATCH_SIZE, 10, 1);
        this.maxAttempts = p.integer(JOB_MAX_ATTEMPTS, 5, 1);
        this.eventStatuses = p.list(EVENT_STATUSES, List.of("approved", "pending"));
        this.requestTimeout = Duration.ofSeconds(p.integer(REQUEST_TIMEOUT_SECONDS, 30, 1));
        this.jitterCap = Duration.ofSeconds(p.integer(POLL_JITTER_CAP_SECONDS, 30, 0));
    }

    /**
     * Resolves the configuration from system properties and the process
     * environment.
     *
     * @throws ConfigurationException if credentials are missing or values are
     *                                malformed
     */
    public static WorkerConfig fromEnvironment() {
        return load(key -> {
            String property = System.getProperty(key);
            return property != null ? property : System.getenv(key);
        });
    }

    /**
     * Resolves the configuration from an arbitrary lookup function. Blank
     * values count as unset.
     *
     * @throws ConfigurationException if credentials are missing or values are
     *                                malformed
     */
    public static WorkerConfig load(Function<String, String> lookup) {
        Parser parser = new Parser(lookup, ApplicationMode.resolve(lookup));
        WorkerConfig config = new WorkerConfig(parser);
        if (!parser.missing.isEmpty() || !parser.invalid.isEmpty()) {
            throw new ConfigurationException(parser.missing, parser.invalid);
        }
        return config;
    }

    private static String defaultStorageUrl() {
        return "jdbc:sqlite:" + DataDirectories.appDataDir(APP_NAME).resolve(APP_NAME + ".db").toAbsolutePath();
    }

    public ApplicationMode getApplicationMode() {
        return applicationMode;
    }

    public WorkerMode getWorkerMode() {
        return workerMode;
    }

    public String getStorageUrl() {
        return storageUrl;
    }

    public String getStorageKey() {
        return storageKey;
    }

    /** JDBC user name, {@code null} when the backend does not need one. */
    public String getStorageUser() {
        return storageUser;
    }

    public String getRedditClientId() {
        return redditClientId;
    }

    public String getRedditClientSecret() {
        return redditClientSecret;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getMaxPostsPerTarget() {
        return maxPostsPerTarget;
    }

    public int getMaxCommentsPerPost() {
        return maxCommentsPerPost;
    }

    public boolean isSearchFallback() {
        return searchFallback;
    }

    public int getJobBatchSize() {
        return jobBatchSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public List<String> getEventStatuses() {
        return eventStatuses;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getJitterCap() {
        return jitterCap;
    }

    @Override
    public String toString() {
        // Credentials are deliberately absent
        return "WorkerConfig{mode=" + applicationMode + ", workerMode=" + workerMode
                + ", storageUrl=" + storageUrl + ", poll=" + pollInterval.toSeconds() + "s"
                + ", maxPosts=" + maxPostsPerTarget + ", maxComments=" + maxCommentsPerPost
                + ", batch=" + jobBatchSize + ", maxAttempts=" + maxAttempts + "}";
    }

    /**
     * Collects values and problems while the constructor reads each setting,
     * so one failed startup reports every broken variable at once.
     */
    private static final class Parser {

        private final Function<String, String> lookup;
        private final ApplicationMode mode;
        private final List<String> missing = new ArrayList<>();
        private final List<String> invalid = new ArrayList<>();

        Parser(Function<String, String> lookup, ApplicationMode mode) {
            this.lookup = lookup;
            this.mode = mode;
        }

        private String raw(String key) {
            String value = lookup.apply(key);
            return value == null || value.isBlank() ? null : value.trim();
        }

        String string(String key, String fallback) {
            String value = raw(key);
            return value != null ? value : fallback;
        }

        /** Credentials are only enforced in PROD; TEST mode never leaves the process. */
        String required(String key) {
            String value = raw(key);
            if (value == null && !mode.isTest()) {
                missing.add(key);
            }
            return value;
        }

        int integer(String key, int fallback, int min) {
            String value = raw(key);
            if (value == null)
                return fallback;
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < min) {
                    invalid.add(key + " must be >= " + min + " (was " + value + ")");
                    return fallback;
                }
                return parsed;
            } catch (NumberFormatException e) {
                invalid.add(key + " is not a number (was '" + value + "')");
                return fallback;
            }
        }

        /** Only JDBC and PostgREST backends exist. */
        String storageUrl(String key, String fallback) {
            String value = string(key, fallback);
            String lower = value.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("jdbc:") && !lower.startsWith("http://") && !lower.startsWith("https://")) {
                invalid.add(key + " must start with jdbc:, http:// or https:// (was '" + value + "')");
            }
            return value;
        }

        boolean bool(String key, boolean fallback) {
            String value = raw(key);
            if (value == null)
                return fallback;
            if (value.equalsIgnoreCase("true") || value.equals("1"))
                return true;
            if (value.equalsIgnoreCase("false") || value.equals("0"))
                return false;
            invalid.add(key + " is not a boolean (was '" + value + "')");
            return fallback;
        }

        <E extends Enum<E>> E enumValue(String key, Class<E> type, E fallback) {
            String value = raw(key);
            if (value == null)
                return fallback;
            try {
                return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                invalid.add(key + " must be one of " + Arrays.toString(type.getEnumConstants())
                        + " (was '" + value + "')");
                return fallback;
            }
        }

        List<String> list(String key, List<String> fallback) {
            String value = raw(key);
            if (value == null)
                return fallback;
            List<String> parsed = Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toUnmodifiableList());
            return parsed.isEmpty() ? fallback : parsed;
        }
    }
}
