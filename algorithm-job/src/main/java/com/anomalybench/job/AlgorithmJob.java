package com.anomalybench.job;

import com.anomalybench.core.config.Algorithm;
import com.anomalybench.core.config.AlgorithmArgs;
import com.anomalybench.core.config.ArgsLoader;
import com.anomalybench.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Command-line entry point.
 *
 * <h3>Usage</h3>
 *
 * <pre>
 *   AlgorithmJob &lt;algorithm&gt; &lt;json-or-path&gt;
 *   AlgorithmJob &lt;json-or-path&gt;          (algorithm from ANOMALYBENCH_ALGORITHM)
 * </pre>
 *
 * <p>
 * {@code <json-or-path>} is either an inline JSON object or the path of a
 * JSON/YAML configuration file. Any failure is logged at ERROR and the
 * process exits with status 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlgorithmJob {

    private static final Logger LOG = LoggerFactory.getLogger(AlgorithmJob.class);

    /** Environment variable naming the algorithm when only one argument is given. */
    public static final String ENV_ALGORITHM = "ANOMALYBENCH_ALGORITHM";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private AlgorithmJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        int status = run(args, System.getenv());
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Parse the arguments and run the configured pass.
     *
     * @param args        command-line arguments
     * @param environment environment variables
     * @return process exit status
     */
    static int run(String[] args, Map<String, String> environment) {
        try {
            // 1. Resolve the algorithm and its configuration
            AlgorithmArgs algorithmArgs = parse(args, environment);
            LOG.info("Running '{}' in {} mode", algorithmArgs.getAlgorithm().getId(),
                    algorithmArgs.getExecutionType().wireName());

            // 2. Train or execute
            new AlgorithmRunner().run(algorithmArgs);
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    static AlgorithmArgs parse(String[] args, Map<String, String> environment) {
        String algorithmId;
        String configuration;
        if (args.length == 2) {
            algorithmId = args[0];
            configuration = args[1];
        } else if (args.length == 1) {
            algorithmId = environment.get(ENV_ALGORITHM);
            if (algorithmId == null || algorithmId.isBlank()) {
                throw new ConfigurationException("Only a configuration was given and " + ENV_ALGORITHM
                        + " is not set; usage: AlgorithmJob [<algorithm>] <json-or-path>");
            }
            configuration = args[0];
        } else {
            throw new ConfigurationException("Wrong number of arguments specified! Expected 1 or 2, got "
                    + args.length + "; usage: AlgorithmJob [<algorithm>] <json-or-path>");
        }
        return ArgsLoader.resolve(configuration, Algorithm.fromId(algorithmId));
    }
}
