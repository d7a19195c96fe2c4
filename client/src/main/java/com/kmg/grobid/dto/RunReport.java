package com.kmg.grobid.dto;

import java.util.List;

public record RunReport(
        String service,
        String inputDirectory,
        String outputDirectory,
        String startedAt,
        String endedAt,
        double runtimeSeconds,
        int batches,
        int written,
        int skipped,
        int failed,
        int retried,
        List<FailedFile> failures
) {
    public record FailedFile(String file, String reason, int statusCode, int attempts) {
    }
}
