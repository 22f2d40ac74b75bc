package com.anomalybench.job;

import com.anomalybench.core.channel.ChannelResolver;
import com.anomalybench.core.config.AlgorithmArgs;
import com.anomalybench.core.detection.AnomalyDetector;
import com.anomalybench.core.detection.DetectorFactory;
import com.anomalybench.core.io.ScoreCsvWriter;
import com.anomalybench.core.io.SeriesCsvReader;
import com.anomalybench.core.model.LabeledSeries;
import com.anomalybench.core.model.ResolvedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs one train or execute pass of a detector over a CSV file.
 *
 * <pre>
 *   dataInput (CSV)
 *     → SeriesCsvReader
 *     → ChannelResolver (target_channels)
 *     → AnomalyDetector.train  → modelOutput
 *     | AnomalyDetector.execute ← modelInput → ScoreCsvWriter → dataOutput
 * </pre>
 *
 * @since 1.0.0
 */
public class AlgorithmRunner {

    private static final Logger LOG = LoggerFactory.getLogger(AlgorithmRunner.class);

    private final SeriesCsvReader reader = new SeriesCsvReader();
    private final ChannelResolver resolver = new ChannelResolver();
    private final ScoreCsvWriter writer = new ScoreCsvWriter();

    /**
     * @param args validated run configuration
     */
    public void run(AlgorithmArgs args) {
        Objects.requireNonNull(args, "AlgorithmArgs must not be null");
        AnomalyDetector detector = DetectorFactory.create(args);

        LabeledSeries series = reader.read(args.getDataInput());
        ResolvedSeries resolved = resolver.resolve(series, args.getCustomParameters().getTargetChannels());

        switch (args.getExecutionType()) {
            case TRAIN -> {
                detector.train(resolved, args.getModelOutput());
                LOG.info("Training of '{}' finished", detector.getAlgorithmId());
            }
            case EXECUTE -> {
                double[][] scores = detector.execute(resolved, args.getModelInput());
                writer.write(args.getDataOutput(), scores);
                LOG.info("Execution of '{}' finished", detector.getAlgorithmId());
            }
        }
    }
}
