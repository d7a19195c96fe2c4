package com.kmg.grobid.config;

import java.time.Duration;
import java.util.List;

/**
 * Immutable configuration for one run, shared read-only by every worker.
 *
 * @param coordinates TEI element names for which coordinates are requested, one form part each
 * @param maxAttempts total submissions allowed per file while the service answers 503; 0 is unbounded
 */
public record ClientSettings(
        String apiBase,
        int batchSize,
        int workerCount,
        Duration sleepTime,
        List<String> coordinates,
        int maxAttempts,
        double backoffMultiplier,
        Duration maxSleepTime
) {
    public ClientSettings {
        if (apiBase == null || apiBase.isBlank()) {
            throw new IllegalArgumentException("apiBase is required");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        if (sleepTime == null || sleepTime.isNegative()) {
            throw new IllegalArgumentException("sleepTime must not be negative");
        }
        coordinates = coordinates == null ? List.of() : coordinates.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .toList();
    }

    public static ClientSettings from(GrobidProperties properties) {
        return new ClientSettings(
                apiBase(properties.getServer(), properties.getPort()),
                properties.getBatchSize(),
                properties.getNumberOfProcesses(),
                properties.getSleepTime(),
                properties.getCoordinates(),
                properties.getRetry().getMaxAttempts(),
                properties.getRetry().getBackoffMultiplier(),
                properties.getRetry().getMaxSleepTime()
        );
    }

    public ClientSettings withWorkerCount(int workers) {
        return new ClientSettings(apiBase, batchSize, workers, sleepTime, coordinates,
                maxAttempts, backoffMultiplier, maxSleepTime);
    }

    /**
     * {@code http://server[:port]}; a server value that already names a scheme is kept as is.
     */
    public static String apiBase(String server, Integer port) {
        String base = server.trim();
        if (!base.startsWith("http://") && !base.startsWith("https://")) {
            base = "http://" + base;
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (port != null) {
            base = base + ":" + port;
        }
        return base;
    }
}
