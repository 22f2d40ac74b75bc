package com.anomalybench.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Replace-on-success file writes.
 *
 * <p>
 * Content is written to a temporary file in the destination's directory and
 * then moved onto the destination in one step, so readers observe either the
 * previous complete file or the new complete file. The temporary file is
 * removed on every exit path.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArtifactFiles {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactFiles.class);

    private ArtifactFiles() {
        // utility class, not instantiable
    }

    /**
     * Body of an atomic write.
     */
    @FunctionalInterface
    public interface StreamWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    /**
     * Body that fills a temporary file given its path.
     */
    @FunctionalInterface
    public interface FileWriter {
        void writeTo(Path temporary) throws IOException;
    }

    /**
     * Stream content into {@code target}, replacing it atomically.
     *
     * @param target destination file
     * @param body   writes the content; must not close over the target
     * @throws IOException if writing or moving fails; the target is untouched
     */
    public static void writeAtomically(Path target, StreamWriter body) throws IOException {
        replaceAtomically(target, temporary -> {
            try (OutputStream out = Files.newOutputStream(temporary)) {
                body.writeTo(out);
            }
        });
    }

    /**
     * Let {@code body} fill a temporary sibling of {@code target}, then move it
     * onto {@code target}.
     *
     * @param target destination file
     * @param body   fills the temporary file
     * @throws IOException if the body or the move fails; the target is untouched
     */
    public static void replaceAtomically(Path target, FileWriter body) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);
        Path temporary = Files.createTempFile(directory, "." + absolute.getFileName() + ".", ".tmp");
        try {
            body.writeTo(temporary);
            move(temporary, absolute);
        } finally {
            Files.deleteIfExists(temporary);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}; falling back to a plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
