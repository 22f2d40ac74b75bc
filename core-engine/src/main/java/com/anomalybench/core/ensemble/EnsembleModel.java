package com.anomalybench.core.ensemble;

import com.anomalybench.core.error.MissingArtifactException;
import com.anomalybench.core.io.ArtifactFiles;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A fitted isolation forest together with the windowing it was fitted on.
 *
 * <p>
 * Persisted as one self-contained JSON document. Immutable once fitted.
 * </p>
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class EnsembleModel {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleModel.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private int windowSize;
    private int channelCount;
    private IsolationForest forest;

    private EnsembleModel() {
        // for Jackson
    }

    public EnsembleModel(int windowSize, int channelCount, IsolationForest forest) {
        this.windowSize = windowSize;
        this.channelCount = channelCount;
        this.forest = Objects.requireNonNull(forest, "forest must not be null");
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getChannelCount() {
        return channelCount;
    }

    public IsolationForest getForest() {
        return forest;
    }

    public double getContamination() {
        return forest.getContamination();
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * Write the model, replacing any previous file atomically.
     *
     * @param path destination
     * @throws IllegalStateException if writing fails
     */
    public void write(Path path) {
        try {
            ArtifactFiles.writeAtomically(path, out -> MAPPER.writeValue(out, this));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write ensemble model to " + path, e);
        }
        LOG.info("Model saved to {}", path);
    }

    /**
     * Read a model written by {@link #write(Path)}.
     *
     * @param path model file
     * @return the model
     * @throws MissingArtifactException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or parsed
     */
    public static EnsembleModel read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            EnsembleModel model = MAPPER.readValue(in, EnsembleModel.class);
            LOG.info("Model loaded {}", path);
            return model;
        } catch (NoSuchFileException e) {
            throw new MissingArtifactException(path, "Ensemble model");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ensemble model from " + path, e);
        }
    }
}
