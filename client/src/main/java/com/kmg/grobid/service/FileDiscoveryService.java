package com.kmg.grobid.service;

import com.kmg.grobid.config.GrobidProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Service
public class FileDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(FileDiscoveryService.class);

    private final String extension;

    public FileDiscoveryService(GrobidProperties properties) {
        this.extension = properties.getInput().getExtension().toLowerCase(Locale.ROOT);
    }

    /**
     * Lazily walks {@code root} and yields every regular file carrying the document extension.
     * The stream holds an open directory handle and must be closed. Each call walks the tree again.
     *
     * <p>A subdirectory that cannot be opened or listed is logged and skipped along with its
     * subtree; the rest of the walk goes on. Symbolic links to directories are not followed.</p>
     *
     * @throws InvalidInputRootException if root does not exist or is not a directory
     * @throws DiscoveryException        if root itself cannot be listed
     */
    public Stream<Path> discover(Path root) {
        Path path = validateRoot(root);
        DocumentWalker walker = new DocumentWalker(path);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(walker, Spliterator.ORDERED | Spliterator.NONNULL), false
        ).onClose(walker::close);
    }

    public Path validateRoot(Path root) {
        if (root == null) {
            throw new InvalidInputRootException("Input directory is required");
        }
        Path path = root.toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new InvalidInputRootException("Input directory does not exist: " + path);
        }
        if (!Files.isDirectory(path)) {
            throw new InvalidInputRootException("Input path is not a directory: " + path);
        }
        return path;
    }

    boolean isDocument(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }

    DirectoryStream<Path> openDirectory(Path directory) throws IOException {
        return Files.newDirectoryStream(directory);
    }

    /**
     * Depth-first walk holding at most one directory stream open at a time.
     */
    private final class DocumentWalker implements Iterator<Path> {
        private final Deque<Path> pending = new ArrayDeque<>();
        private DirectoryStream<Path> stream;
        private Iterator<Path> entries;
        private Path directory;
        private Path next;

        DocumentWalker(Path root) {
            try {
                open(root);
            } catch (IOException e) {
                throw new DiscoveryException("Failed to scan folder " + root + ": " + e.getMessage(), e);
            }
        }

        @Override
        public boolean hasNext() {
            while (next == null) {
                if (entries == null && !openNextDirectory()) {
                    return false;
                }
                try {
                    if (entries.hasNext()) {
                        accept(entries.next());
                    } else {
                        close();
                    }
                } catch (DirectoryIteratorException e) {
                    log.warn("Skipping the rest of folder {}: {}", directory, e.getCause().getMessage());
                    close();
                }
            }
            return true;
        }

        @Override
        public Path next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Path result = next;
            next = null;
            return result;
        }

        private void accept(Path entry) {
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                pending.push(entry);
            } else if (Files.isRegularFile(entry) && isDocument(entry)) {
                next = entry;
            }
        }

        private boolean openNextDirectory() {
            while (!pending.isEmpty()) {
                Path candidate = pending.pop();
                try {
                    open(candidate);
                    return true;
                } catch (IOException e) {
                    log.warn("Skipping unreadable folder {}: {}", candidate, e.toString());
                }
            }
            return false;
        }

        private void open(Path candidate) throws IOException {
            stream = openDirectory(candidate);
            entries = stream.iterator();
            directory = candidate;
        }

        void close() {
            if (stream == null) {
                return;
            }
            try {
                stream.close();
            } catch (IOException e) {
                log.warn("Failed to close folder {}: {}", directory, e.getMessage());
            } finally {
                stream = null;
                entries = null;
            }
        }
    }

    public static class InvalidInputRootException extends IllegalArgumentException {
        public InvalidInputRootException(String message) {
            super(message);
        }
    }

    public static class DiscoveryException extends RuntimeException {
        public DiscoveryException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
