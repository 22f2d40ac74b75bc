package com.anomalybench.core.reconstruction;

import com.anomalybench.core.io.ArtifactFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs a checkpoint directory into the model archive.
 *
 * <p>
 * The archive is a zip holding {@value ReconstructionArchive#BEST_MODEL_ENTRY}
 * and {@value ReconstructionArchive#METADATA_ENTRY}. It is built in a
 * temporary sibling and moved over the previous archive, so an interrupted
 * run always leaves the last complete archive behind.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckpointArchiver {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointArchiver.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path checkpointDirectory;
    private final Path archive;

    public CheckpointArchiver(Path checkpointDirectory, Path archive) {
        this.checkpointDirectory = Objects.requireNonNull(checkpointDirectory, "checkpointDirectory must not be null");
        this.archive = Objects.requireNonNull(archive, "archive must not be null");
    }

    /**
     * Describe the weights currently in the checkpoint directory.
     *
     * @param metadata epoch and loss of the checkpoint
     * @throws IOException if the file cannot be written
     */
    public void recordMetadata(CheckpointMetadata metadata) throws IOException {
        ArtifactFiles.writeAtomically(checkpointDirectory.resolve(ReconstructionArchive.METADATA_ENTRY),
                out -> MAPPER.writeValue(out, metadata));
    }

    /**
     * Replace the archive with the current checkpoint, if there is one.
     *
     * @return {@code false} when no checkpoint has been written yet
     * @throws IOException if packing or moving fails; the old archive is untouched
     */
    public boolean archiveIfPresent() throws IOException {
        Path model = checkpointDirectory.resolve(ReconstructionArchive.BEST_MODEL_ENTRY);
        Path metadata = checkpointDirectory.resolve(ReconstructionArchive.METADATA_ENTRY);
        if (!Files.isRegularFile(model) || !Files.isRegularFile(metadata)) {
            return false;
        }

        ArtifactFiles.writeAtomically(archive, out -> {
            ZipOutputStream zip = new ZipOutputStream(out);
            addEntry(zip, ReconstructionArchive.BEST_MODEL_ENTRY, model);
            addEntry(zip, ReconstructionArchive.METADATA_ENTRY, metadata);
            zip.finish();
        });
        LOG.debug("Archived checkpoint to {}", archive);
        return true;
    }

    private static void addEntry(ZipOutputStream zip, String name, Path source) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        Files.copy(source, zip);
        zip.closeEntry();
    }
}
