package com.anomalybench.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered mapping from selected channel name to its zero-based column index
 * in the resolved data matrix.
 *
 * <p>
 * Indices are dense ({@code 0..size-1}) and follow the order in which the
 * channels were added, so column {@code i} of the resolved matrix always
 * belongs to {@code getChannelNames().get(i)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChannelSelection {

    private final Map<String, Integer> indices;
    private final boolean allChannels;

    private ChannelSelection(List<String> channels, boolean allChannels) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (String channel : channels) {
            Objects.requireNonNull(channel, "Channel name must not be null");
            if (map.putIfAbsent(channel, map.size()) != null) {
                throw new IllegalArgumentException("Duplicate channel in selection: " + channel);
            }
        }
        this.indices = Collections.unmodifiableMap(map);
        this.allChannels = allChannels;
    }

    /**
     * Selection of every channel of the series, in source column order.
     *
     * @param channels all channel names
     * @return the selection
     */
    public static ChannelSelection all(List<String> channels) {
        return new ChannelSelection(channels, true);
    }

    /**
     * Selection of a subset of channels.
     *
     * @param channels selected channel names, already in the desired order
     * @return the selection
     */
    public static ChannelSelection of(List<String> channels) {
        return new ChannelSelection(channels, false);
    }

    public int size() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    /**
     * @return {@code true} if the selection fell back to every channel
     */
    public boolean isAllChannels() {
        return allChannels;
    }

    public List<String> getChannelNames() {
        return Collections.unmodifiableList(new ArrayList<>(indices.keySet()));
    }

    /**
     * @param channel channel name
     * @return index in the resolved matrix
     * @throws IllegalArgumentException if the channel is not selected
     */
    public int indexOf(String channel) {
        Integer index = indices.get(channel);
        if (index == null) {
            throw new IllegalArgumentException("Channel not selected: " + channel);
        }
        return index;
    }

    public Map<String, Integer> asMap() {
        return indices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChannelSelection that))
            return false;
        return allChannels == that.allChannels && indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indices, allChannels);
    }

    @Override
    public String toString() {
        return "ChannelSelection" + indices + (allChannels ? " (all)" : "");
    }
}
