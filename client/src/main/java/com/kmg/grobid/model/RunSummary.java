package com.kmg.grobid.model;

import java.time.Duration;

public record RunSummary(int batches, int written, int skipped, int failed, int retried, Duration elapsed) {

    public int total() {
        return written + skipped + failed;
    }
}
