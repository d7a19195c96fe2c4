package com.kmg.grobid.model;

import java.util.List;

/**
 * Processing flags sent with every request of a run.
 *
 * @param coordinates TEI element names for which coordinates are requested
 */
public record OptionSet(
        boolean generateIds,
        boolean consolidateHeader,
        boolean consolidateCitations,
        boolean includeCoordinates,
        List<String> coordinates
) {
    public OptionSet {
        coordinates = coordinates == null ? List.of() : List.copyOf(coordinates);
    }

    public static OptionSet none() {
        return new OptionSet(false, false, false, false, List.of());
    }
}
