package com.kmg.grobid.model;

import java.nio.file.Path;
import java.util.List;

public record Batch(int index, List<Path> files) {
    public Batch {
        files = List.copyOf(files);
    }

    public int size() {
        return files.size();
    }
}
