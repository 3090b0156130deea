package org.rostilos.reviewpipe.analysisengine.stage;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.reviewpipe.analysisengine.exception.DiffTooLargeException;
import org.rostilos.reviewpipe.analysisengine.exception.StageFailureException;
import org.rostilos.reviewpipe.analysisengine.util.TokenEstimator;
import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage that delegates analysis to an HTTP review service.
 * <p>
 * Request body: {@code {stage, focus, summary, prompt}}. Accepted responses:
 * {@code {findings: [...], usage: {...}}}, {@code {content: "..."}} with a JSON array somewhere
 * in the text, or a bare array of findings.
 */
public class RemoteAnalysisStage extends AbstractAnalysisStage {
    private static final Logger log = LoggerFactory.getLogger(RemoteAnalysisStage.class);

    private final RestTemplate restTemplate;
    private final String endpointUrl;
    private final String focus;
    private final int maxPromptTokens;
    private final StagePromptFormatter promptFormatter;
    private final FindingsResponseParser responseParser;

    public RemoteAnalysisStage(
            String name,
            String focus,
            String endpointUrl,
            int maxPromptTokens,
            RestTemplate restTemplate,
            StagePromptFormatter promptFormatter,
            FindingsResponseParser responseParser
    ) {
        super(name);
        this.focus = focus;
        this.endpointUrl = endpointUrl;
        this.maxPromptTokens = maxPromptTokens;
        this.restTemplate = restTemplate;
        this.promptFormatter = promptFormatter;
        this.responseParser = responseParser;
    }

    @Override
    protected StageOutput analyze(AnalysisContext context) {
        String prompt = promptFormatter.buildPrompt(focus, context);

        TokenEstimator.TokenEstimationResult estimate = TokenEstimator.estimateAndCheck(prompt, maxPromptTokens);
        log.info("Stage '{}' prompt size: {}", getName(), estimate.toLogString());
        if (estimate.exceedsLimit()) {
            throw new DiffTooLargeException(estimate.estimatedTokens(), maxPromptTokens, getName());
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("stage", getName());
        request.put("focus", focus);
        request.put("summary", context.diff().getSummary());
        request.put("prompt", prompt);

        JsonNode response;
        try {
            log.debug("Sending stage '{}' request to {}", getName(), endpointUrl);
            response = restTemplate.postForObject(endpointUrl, request, JsonNode.class);
        } catch (RestClientException e) {
            throw new StageFailureException(getName(), "review service call failed: " + e.getMessage(), e);
        }
        if (response == null || response.isNull()) {
            throw new StageFailureException(getName(), "review service returned an empty response");
        }

        List<Finding> findings;
        if (response.isArray()) {
            findings = responseParser.parseFindings(getName(), response);
        } else if (response.has("findings")) {
            findings = responseParser.parseFindings(getName(), response.get("findings"));
        } else if (response.path("content").isTextual()) {
            findings = responseParser.parseFindingsFromText(getName(), response.get("content").asText());
        } else {
            throw new StageFailureException(getName(), "response has neither 'findings' nor 'content'");
        }

        log.info("Stage '{}' received {} finding(s)", getName(), findings.size());
        return new StageOutput(findings, responseParser.parseUsage(response.get("usage")));
    }
}
