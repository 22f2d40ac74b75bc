package com.anomalybench.core.reconstruction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CheckpointArchiver}.
 */
class CheckpointArchiverTest {

    @TempDir
    Path tempDir;

    private Path checkpoints;
    private Path archive;
    private CheckpointArchiver archiver;

    @BeforeEach
    void setUp() throws IOException {
        checkpoints = Files.createDirectory(tempDir.resolve("checkpoints"));
        archive = tempDir.resolve("out").resolve("model.zip");
        archiver = new CheckpointArchiver(checkpoints, archive);
    }

    private static String entry(ZipFile zip, String name) throws IOException {
        ZipEntry entry = zip.getEntry(name);
        assertThat(entry).as("entry %s", name).isNotNull();
        return new String(zip.getInputStream(entry).readAllBytes(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Nothing is archived before a checkpoint exists")
    void shouldSkipWithoutCheckpoint() throws IOException {
        assertThat(archiver.archiveIfPresent()).isFalse();
        assertThat(archive).doesNotExist();
    }

    @Test
    @DisplayName("Weights without metadata are not archived")
    void shouldSkipWithoutMetadata() throws IOException {
        Files.writeString(checkpoints.resolve(ReconstructionArchive.BEST_MODEL_ENTRY), "weights");

        assertThat(archiver.archiveIfPresent()).isFalse();
        assertThat(archive).doesNotExist();
    }

    @Test
    @DisplayName("The archive holds the weights and the metadata of the checkpoint")
    void shouldArchiveCheckpoint() throws IOException {
        Files.writeString(checkpoints.resolve(ReconstructionArchive.BEST_MODEL_ENTRY), "weights-1");
        archiver.recordMetadata(new CheckpointMetadata(3, 0.25, 2));

        assertThat(archiver.archiveIfPresent()).isTrue();

        try (ZipFile zip = new ZipFile(archive.toFile())) {
            assertThat(entry(zip, ReconstructionArchive.BEST_MODEL_ENTRY)).isEqualTo("weights-1");
            assertThat(entry(zip, ReconstructionArchive.METADATA_ENTRY))
                    .contains("\"epoch\":3")
                    .contains("\"validationLoss\":0.25")
                    .contains("\"channelCount\":2");
        }
    }

    @Test
    @DisplayName("A newer checkpoint replaces the archive and leaves no temporary files")
    void shouldReplacePreviousArchive() throws IOException {
        Path weights = checkpoints.resolve(ReconstructionArchive.BEST_MODEL_ENTRY);
        Files.writeString(weights, "weights-1");
        archiver.recordMetadata(new CheckpointMetadata(0, 0.9, 1));
        archiver.archiveIfPresent();

        Files.writeString(weights, "weights-2");
        archiver.recordMetadata(new CheckpointMetadata(4, 0.1, 1));
        archiver.archiveIfPresent();

        try (ZipFile zip = new ZipFile(archive.toFile())) {
            assertThat(entry(zip, ReconstructionArchive.BEST_MODEL_ENTRY)).isEqualTo("weights-2");
            assertThat(entry(zip, ReconstructionArchive.METADATA_ENTRY)).contains("\"epoch\":4");
        }
        try (Stream<Path> files = Files.list(archive.getParent())) {
            assertThat(files).containsExactly(archive);
        }
        try (Stream<Path> files = Files.list(checkpoints)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder(ReconstructionArchive.BEST_MODEL_ENTRY,
                            ReconstructionArchive.METADATA_ENTRY);
        }
    }
}
