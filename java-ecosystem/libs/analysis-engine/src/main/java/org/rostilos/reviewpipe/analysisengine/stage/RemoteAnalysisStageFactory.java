package org.rostilos.reviewpipe.analysisengine.stage;

import org.rostilos.reviewpipe.analysisengine.exception.PipelineSetupException;
import org.springframework.web.client.RestTemplate;

/**
 * Creates {@link RemoteAnalysisStage}s that share one HTTP client and one review-service endpoint.
 */
public class RemoteAnalysisStageFactory implements AnalysisStageFactory {

    private final RestTemplate restTemplate;
    private final String endpointUrl;
    private final int maxPromptTokens;
    private final StagePromptFormatter promptFormatter;
    private final FindingsResponseParser responseParser;

    public RemoteAnalysisStageFactory(
            RestTemplate restTemplate,
            String endpointUrl,
            int maxPromptTokens,
            StagePromptFormatter promptFormatter,
            FindingsResponseParser responseParser
    ) {
        this.restTemplate = restTemplate;
        this.endpointUrl = endpointUrl;
        this.maxPromptTokens = maxPromptTokens;
        this.promptFormatter = promptFormatter;
        this.responseParser = responseParser;
    }

    @Override
    public AnalysisStage create(StageDefinition definition) {
        if (endpointUrl == null || endpointUrl.isBlank()) {
            throw new PipelineSetupException("Review service URL is not configured (reviewpipe.ai.url)");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            throw new PipelineSetupException("Stage definition without a name");
        }
        return new RemoteAnalysisStage(
                definition.name(),
                definition.focus(),
                endpointUrl,
                maxPromptTokens,
                restTemplate,
                promptFormatter,
                responseParser
        );
    }
}
