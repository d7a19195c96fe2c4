package com.kmg.grobid.model;

import java.time.Duration;

public record RetryDecision(Action action, byte[] body, Duration delay, int statusCode, String reason) {

    public enum Action { ACCEPT, RETRY, FAIL }

    public static RetryDecision accept(byte[] body) {
        return new RetryDecision(Action.ACCEPT, body, Duration.ZERO, 200, null);
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(Action.RETRY, null, delay, 503, "service temporarily overloaded");
    }

    public static RetryDecision fail(int statusCode, String reason) {
        return new RetryDecision(Action.FAIL, null, Duration.ZERO, statusCode, reason);
    }
}
