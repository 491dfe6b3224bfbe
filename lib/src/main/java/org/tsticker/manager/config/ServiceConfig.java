package org.tsticker.manager.config;

import java.time.Duration;

public class ServiceConfig {

    public static final int MAX_COLLECTION_SIZE = 120;
    public static final int MAX_INITIAL_BATCH_SIZE = 30;

    public static final int STICKER_SCALE = 512;
    public static final int CUSTOM_EMOJI_SCALE = 100;
    public static final String DEFAULT_EMOJI = "❤️";

    // 30 requests per minute
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 20;
    public static final Duration DEFAULT_REQUEST_INTERVAL = Duration.ofSeconds(2);

    public static final int DEFAULT_SNAPSHOT_RETENTION = 4;
    public static final int DEFAULT_READ_RETRIES = 1;

    private ServiceConfig() {
    }
}
