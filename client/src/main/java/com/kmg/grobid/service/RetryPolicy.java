package com.kmg.grobid.service;

import com.kmg.grobid.config.ClientSettings;
import com.kmg.grobid.model.RetryDecision;
import com.kmg.grobid.model.ServiceResponse;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Maps a response to accept, retry or fail. Only 503 is retried; with the default settings
 * it is retried without limit after a fixed {@code sleep_time}.
 */
@Component
public class RetryPolicy {
    static final int OK = 200;
    static final int SERVICE_UNAVAILABLE = 503;

    /**
     * @param attempt 1-based number of the submission that produced {@code response}
     */
    public RetryDecision classify(ServiceResponse response, int attempt, ClientSettings settings) {
        int status = response.statusCode();
        if (status == OK) {
            return RetryDecision.accept(response.body());
        }
        if (status == SERVICE_UNAVAILABLE) {
            if (settings.maxAttempts() > 0 && attempt >= settings.maxAttempts()) {
                return RetryDecision.fail(status, "service still overloaded after " + attempt + " attempts");
            }
            return RetryDecision.retryAfter(delayFor(attempt, settings));
        }
        return RetryDecision.fail(status, "response status code " + status);
    }

    Duration delayFor(int attempt, ClientSettings settings) {
        Duration base = settings.sleepTime();
        if (settings.backoffMultiplier() <= 1.0 || attempt <= 1) {
            return base;
        }
        double factor = Math.pow(settings.backoffMultiplier(), attempt - 1);
        double millis = base.toMillis() * factor;
        long cap = Math.max(base.toMillis(), settings.maxSleepTime().toMillis());
        if (Double.isInfinite(millis) || millis > cap) {
            return Duration.ofMillis(cap);
        }
        return Duration.ofMillis(Math.round(millis));
    }
}
