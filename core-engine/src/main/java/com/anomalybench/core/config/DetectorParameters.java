package com.anomalybench.core.config;

import com.anomalybench.core.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameters every detector accepts, bound from the snake_case
 * {@code customParameters} object of the harness configuration.
 *
 * <p>
 * Subclasses add their algorithm-specific fields and extend
 * {@link #collectErrors(List)}. Jackson binds fields directly; the accessors
 * are for Java callers only.
 * </p>
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public abstract class DetectorParameters {

    /** Seed for every random draw the detector makes during training. */
    @JsonProperty("random_state")
    private long randomState = 42L;

    /** Channels to analyse; {@code null} or empty selects every channel. */
    @JsonProperty("target_channels")
    private List<String> targetChannels;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every field and report all problems at once.
     *
     * @throws ConfigurationException if one or more values are out of range
     */
    public final void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid " + getClass().getSimpleName() + ": "
                    + String.join("; ", errors));
        }
    }

    /**
     * Append a message for every invalid field.
     *
     * @param errors sink for error messages
     */
    protected void collectErrors(List<String> errors) {
        if (targetChannels != null && targetChannels.stream().anyMatch(c -> c == null || c.isBlank())) {
            errors.add("'target_channels' must not contain blank names");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public long getRandomState() {
        return randomState;
    }

    public void setRandomState(long randomState) {
        this.randomState = randomState;
    }

    /**
     * @return unmodifiable requested channel list, empty when none was given
     */
    public List<String> getTargetChannels() {
        return targetChannels == null ? Collections.emptyList() : Collections.unmodifiableList(targetChannels);
    }

    public void setTargetChannels(List<String> targetChannels) {
        this.targetChannels = targetChannels != null ? new ArrayList<>(targetChannels) : null;
    }
}
