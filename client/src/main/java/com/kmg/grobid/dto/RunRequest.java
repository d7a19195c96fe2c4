package com.kmg.grobid.dto;

import com.kmg.grobid.config.ClientSettings;
import com.kmg.grobid.model.OptionSet;
import com.kmg.grobid.model.ServiceOperation;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a run needs, fixed before the first file is submitted.
 *
 * @param outputDirectory null to write results beside the source documents
 * @param reportPath      null to skip the JSON report
 */
public record RunRequest(
        ServiceOperation operation,
        Path inputDirectory,
        Path outputDirectory,
        OptionSet options,
        boolean force,
        ClientSettings settings,
        Path reportPath
) {
    public RunRequest {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(settings, "settings");
    }
}
