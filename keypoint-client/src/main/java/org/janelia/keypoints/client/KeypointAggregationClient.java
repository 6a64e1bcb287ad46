package org.janelia.keypoints.client;

import com.beust.jcommander.ParametersDelegate;

import org.janelia.keypoints.aggregate.AggregationResult;
import org.janelia.keypoints.aggregate.KeypointAggregationPipeline;
import org.janelia.keypoints.client.parameter.CommandLineParameters;
import org.janelia.keypoints.client.parameter.StorageParameters;
import org.janelia.keypoints.match.ImagePairList;
import org.janelia.keypoints.parameters.KeypointAggregationParameters;
import org.janelia.keypoints.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for consolidating stored dense pair correspondences into
 * canonical per image keypoints and pair match arrays.
 */
public class KeypointAggregationClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public StorageParameters storage = new StorageParameters();

        @ParametersDelegate
        public KeypointAggregationParameters aggregation = new KeypointAggregationParameters();

        @Override
        public void validate()
                throws IllegalArgumentException {
            storage.validate();
            aggregation.validateAndSetDefaults();
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args,
                                  final CancellationToken cancellationToken) throws Exception {

                final Parameters parameters = new Parameters();
                if (! parameters.parse(args)) {
                    return;
                }

                LOG.info("runClient: entry, parameters={}", parameters);

                final KeypointAggregationClient client = new KeypointAggregationClient(parameters);
                final AggregationResult result = client.aggregate(cancellationToken);
                if (result.isCancelled()) {
                    throw new IllegalStateException("aggregation was cancelled before all pairs were processed");
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public KeypointAggregationClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public AggregationResult aggregate(final CancellationToken cancellationToken)
            throws Exception {

        final ImagePairList pairList = ImagePairList.load(parameters.storage.pairsPath);

        final KeypointAggregationPipeline pipeline =
                new KeypointAggregationPipeline(parameters.aggregation,
                                                parameters.storage.buildCorrespondenceStore(),
                                                parameters.storage.buildMatchStore(),
                                                parameters.storage.buildKeypointStore(),
                                                parameters.storage.buildReferenceKeypointStores());

        final AggregationResult result = pipeline.run(pairList.getPairs(), null, cancellationToken);

        LOG.info("aggregate: exit, result={}, reassignment={}", result, result.getReassignmentResult());

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(KeypointAggregationClient.class);
}
