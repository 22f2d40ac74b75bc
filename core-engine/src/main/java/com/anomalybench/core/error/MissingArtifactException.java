package com.anomalybench.core.error;

import java.nio.file.Path;

/**
 * Raised when execute runs without the artifact a prior train run should
 * have written.
 *
 * @since 1.0.0
 */
public class MissingArtifactException extends AnomalyBenchException {

    private static final long serialVersionUID = 1L;

    private final transient Path artifact;

    public MissingArtifactException(Path artifact, String what) {
        super(what + " not found at " + artifact + "; run with executionType=train first");
        this.artifact = artifact;
    }

    /**
     * @return the path that was expected to hold the artifact
     */
    public Path getArtifact() {
        return artifact;
    }
}
