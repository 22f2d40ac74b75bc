package com.anomalybench.core.channel;

import com.anomalybench.core.error.ConfigurationException;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.io.SeriesCsvReader;
import com.anomalybench.core.model.ChannelSelection;
import com.anomalybench.core.model.LabelSchema;
import com.anomalybench.core.model.LabeledSeries;
import com.anomalybench.core.model.ResolvedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Normalises raw channel and label columns into a {@link ResolvedSeries}.
 *
 * <h3>Channel selection</h3>
 * <p>
 * When no channel is requested, or none of the requested names exists, every
 * channel is selected in source column order. Otherwise the selection is the
 * intersection of requested and available channels, still in source column
 * order; channels that were not requested are dropped together with their
 * labels.
 * </p>
 *
 * <h3>Label schema</h3>
 * <p>
 * A single column named exactly {@value #GLOBAL_LABEL} applies to every
 * channel and is broadcast. Otherwise each selected channel needs its own
 * {@code is_anomaly_<channel>} column.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChannelResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelResolver.class);

    /** Name of the label column shared by all channels. */
    public static final String GLOBAL_LABEL = SeriesCsvReader.LABEL_PREFIX;

    /**
     * Resolve the series down to the requested channels.
     *
     * @param series            raw series; must not be {@code null}
     * @param requestedChannels requested channel names; {@code null} or empty
     *                          selects all
     * @return data and labels for the selected channels
     * @throws ConfigurationException if no channel remains
     * @throws DataShapeException     if a selected channel has no label column
     */
    public ResolvedSeries resolve(LabeledSeries series, List<String> requestedChannels) {
        Objects.requireNonNull(series, "Series must not be null");
        ChannelSelection selection = select(series.getChannelNames(), requestedChannels);
        if (selection.isEmpty()) {
            throw new ConfigurationException("No channels left to analyse; input columns: "
                    + series.getColumnNames());
        }

        LabelSchema schema = detectSchema(series.getLabelNames());
        int[] labelColumns = labelColumnsFor(selection, schema, series.getLabelNames());

        List<String> selected = selection.getChannelNames();
        int[] sourceColumns = new int[selected.size()];
        for (int i = 0; i < selected.size(); i++) {
            sourceColumns[i] = series.getChannelNames().indexOf(selected.get(i));
        }

        int rows = series.getRowCount();
        double[][] data = new double[rows][selected.size()];
        int[][] labels = new int[rows][selected.size()];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < selected.size(); c++) {
                data[r][c] = series.getValue(r, sourceColumns[c]);
                labels[r][c] = series.getLabel(r, labelColumns[c]);
            }
        }

        LOG.info("Resolved channels {} with {} labels", selection.asMap(), schema);
        return new ResolvedSeries(data, labels, selection, schema);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static ChannelSelection select(List<String> available, List<String> requested) {
        Set<String> wanted = requested == null ? Set.of() : new LinkedHashSet<>(requested);
        boolean anyPresent = wanted.stream().anyMatch(available::contains);

        if (!anyPresent) {
            LOG.info("Input channels not given or not present in the data, selecting all the channels: {}",
                    available);
            return ChannelSelection.all(available);
        }

        List<String> missing = new ArrayList<>();
        for (String name : wanted) {
            if (!available.contains(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            LOG.warn("Ignoring requested channel(s) not present in the data: {}", missing);
        }

        List<String> chosen = new ArrayList<>();
        for (String name : available) {
            if (wanted.contains(name)) {
                chosen.add(name);
            }
        }
        return ChannelSelection.of(chosen);
    }

    static LabelSchema detectSchema(List<String> labelNames) {
        return labelNames.size() == 1 && GLOBAL_LABEL.equals(labelNames.get(0))
                ? LabelSchema.GLOBAL
                : LabelSchema.PER_CHANNEL;
    }

    private static int[] labelColumnsFor(ChannelSelection selection, LabelSchema schema, List<String> labelNames) {
        List<String> channels = selection.getChannelNames();
        int[] columns = new int[channels.size()];
        for (int i = 0; i < channels.size(); i++) {
            if (schema == LabelSchema.GLOBAL) {
                columns[i] = 0;
                continue;
            }
            String labelName = labelColumnName(channels.get(i));
            int index = labelNames.indexOf(labelName);
            if (index < 0) {
                throw new DataShapeException("Channel '" + channels.get(i) + "' has no label column '"
                        + labelName + "'; available label columns: " + labelNames);
            }
            columns[i] = index;
        }
        return columns;
    }

    /**
     * @param channel channel name
     * @return the per-channel label column name for {@code channel}
     */
    public static String labelColumnName(String channel) {
        return GLOBAL_LABEL + "_" + channel;
    }
}
