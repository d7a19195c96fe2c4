package com.kmg.grobid.service;

import com.kmg.grobid.config.GrobidProperties;
import com.kmg.grobid.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Places service output next to the source document or under an output directory.
 * Output only appears under its final name once it is complete.
 */
@Service
public class ResultWriter {
    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    private final String suffix;
    private final boolean preserveTree;

    public ResultWriter(GrobidProperties properties) {
        this.suffix = properties.getOutput().getSuffix();
        this.preserveTree = properties.getOutput().isPreserveTree();
    }

    /**
     * {@code paper.pdf} becomes {@code paper.tei.xml}, beside the source when {@code outputDirectory}
     * is null. Under an output directory files are flat unless the tree is preserved.
     */
    public Path destinationFor(Path source, Path inputRoot, Path outputDirectory) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String outputName = base + suffix;

        if (outputDirectory == null) {
            Path parent = source.toAbsolutePath().getParent();
            return parent.resolve(outputName);
        }
        if (preserveTree && inputRoot != null) {
            Path root = inputRoot.toAbsolutePath().normalize();
            Path relativeParent = root.relativize(source.toAbsolutePath().normalize()).getParent();
            if (relativeParent != null) {
                return outputDirectory.resolve(relativeParent).resolve(outputName);
            }
        }
        return outputDirectory.resolve(outputName);
    }

    public boolean isProcessed(Path destination) {
        return Files.isRegularFile(destination);
    }

    public Outcome write(Path source, Path destination, byte[] body, int attempts) {
        Path directory = destination.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + destination.getFileName() + ".", ".part");
            Files.write(temp, body);
            moveIntoPlace(temp, destination);
            log.info("Written {} ({} bytes)", destination, body.length);
            return Outcome.written(source, destination, attempts);
        } catch (IOException e) {
            log.error("Processing failed for {} [ERROR]: {}", destination, e.toString());
            deleteTemp(temp);
            return Outcome.failed(source, destination, "write failed: " + e.getMessage(), 200, attempts);
        }
    }

    private void moveIntoPlace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", destination);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
