package com.kmg.grobid.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Extraction modes offered by the service, keyed by their endpoint name under {@code /api}.
 */
public enum ServiceOperation {
    FULL_TEXT("processFulltextDocument"),
    HEADER("processHeaderDocument"),
    REFERENCES("processReferences");

    private final String endpoint;

    ServiceOperation(String endpoint) {
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }

    /**
     * Accepts either the endpoint name ({@code processHeaderDocument}) or the constant name
     * ({@code header}), ignoring case.
     */
    public static ServiceOperation fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service is required, one of " + endpointNames());
        }
        String trimmed = name.trim();
        for (ServiceOperation operation : values()) {
            if (operation.endpoint.equalsIgnoreCase(trimmed) || operation.name().equalsIgnoreCase(trimmed)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown service '" + name + "', expected one of " + endpointNames());
    }

    public static String endpointNames() {
        return Arrays.stream(values())
                .map(ServiceOperation::endpoint)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return endpoint;
    }
}
