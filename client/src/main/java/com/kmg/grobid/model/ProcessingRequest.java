package com.kmg.grobid.model;

import java.nio.file.Path;
import java.util.Objects;

public record ProcessingRequest(Path file, ServiceOperation operation, OptionSet options) {
    public ProcessingRequest {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(options, "options");
    }
}
