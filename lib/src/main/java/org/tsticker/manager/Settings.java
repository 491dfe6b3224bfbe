package org.tsticker.manager;

import org.tsticker.manager.config.ServiceConfig;

import java.time.Duration;

/**
 * @param readRetries how often an idempotent read is repeated after a remote failure, mutating calls are never
 *                    repeated
 */
public record Settings(
        int maxConcurrentRequests, Duration requestInterval, int snapshotRetention, int readRetries
) {

    public static final Settings DEFAULT = new Settings(ServiceConfig.DEFAULT_MAX_CONCURRENT_REQUESTS,
            ServiceConfig.DEFAULT_REQUEST_INTERVAL,
            ServiceConfig.DEFAULT_SNAPSHOT_RETENTION,
            ServiceConfig.DEFAULT_READ_RETRIES);

    public Settings {
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be positive");
        }
        if (requestInterval.isNegative()) {
            throw new IllegalArgumentException("requestInterval must not be negative");
        }
        if (snapshotRetention < 1) {
            throw new IllegalArgumentException("snapshotRetention must be positive");
        }
        if (readRetries < 0) {
            throw new IllegalArgumentException("readRetries must not be negative");
        }
    }
}
