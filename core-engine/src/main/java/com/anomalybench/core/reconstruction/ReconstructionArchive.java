package com.anomalybench.core.reconstruction;

import com.anomalybench.core.error.MissingArtifactException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.util.ModelSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * A trained autoencoder restored from its archive.
 *
 * @since 1.0.0
 */
public final class ReconstructionArchive {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionArchive.class);

    /** Archive entry holding the serialized network. */
    public static final String BEST_MODEL_ENTRY = "bestModel.bin";

    /** Archive entry holding {@link CheckpointMetadata} as JSON. */
    public static final String METADATA_ENTRY = "checkpoint.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MultiLayerNetwork network;
    private final CheckpointMetadata metadata;

    private ReconstructionArchive(MultiLayerNetwork network, CheckpointMetadata metadata) {
        this.network = network;
        this.metadata = metadata;
    }

    public MultiLayerNetwork getNetwork() {
        return network;
    }

    public CheckpointMetadata getMetadata() {
        return metadata;
    }

    /**
     * Open an archive written by {@link CheckpointArchiver}.
     *
     * @param path archive file
     * @return the restored network and its metadata
     * @throws MissingArtifactException if the archive does not exist
     * @throws IllegalStateException    if the archive is unreadable or incomplete
     */
    public static ReconstructionArchive load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MissingArtifactException(path, "Reconstruction model archive");
        }
        try (ZipFile zip = new ZipFile(path.toFile())) {
            CheckpointMetadata metadata;
            try (InputStream in = zip.getInputStream(entry(zip, path, METADATA_ENTRY))) {
                metadata = MAPPER.readValue(in, CheckpointMetadata.class);
            }
            MultiLayerNetwork network;
            try (InputStream in = zip.getInputStream(entry(zip, path, BEST_MODEL_ENTRY))) {
                network = ModelSerializer.restoreMultiLayerNetwork(in, false);
            }
            LOG.info("Model loaded {} ({})", path, metadata);
            return new ReconstructionArchive(network, metadata);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read reconstruction model from " + path, e);
        }
    }

    private static ZipEntry entry(ZipFile zip, Path path, String name) {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            throw new IllegalStateException("Archive " + path + " has no entry '" + name + "'");
        }
        return entry;
    }
}
