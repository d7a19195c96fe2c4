package com.kmg.grobid.model;

import java.nio.file.Path;

/**
 * Terminal result for one input file.
 *
 * @param destination output path, null when it could not be computed
 * @param statusCode  last HTTP status seen, 0 when the service was not reached
 * @param attempts    number of submissions made; more than one means the file was retried
 */
public record Outcome(
        Path source,
        OutcomeStatus status,
        Path destination,
        String reason,
        int statusCode,
        int attempts
) {
    public static Outcome written(Path source, Path destination, int attempts) {
        return new Outcome(source, OutcomeStatus.WRITTEN, destination, null, 200, attempts);
    }

    public static Outcome skipped(Path source, Path destination, String reason) {
        return new Outcome(source, OutcomeStatus.SKIPPED, destination, reason, 0, 0);
    }

    public static Outcome failed(Path source, Path destination, String reason, int statusCode, int attempts) {
        return new Outcome(source, OutcomeStatus.FAILED, destination, reason, statusCode, attempts);
    }

    public boolean retried() {
        return attempts > 1;
    }
}
