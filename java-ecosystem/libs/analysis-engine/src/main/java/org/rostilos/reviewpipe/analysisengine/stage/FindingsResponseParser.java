package org.rostilos.reviewpipe.analysisengine.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.reviewpipe.analysisengine.exception.StageFailureException;
import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.rostilos.reviewpipe.core.model.finding.FindingType;
import org.rostilos.reviewpipe.core.model.finding.Severity;
import org.rostilos.reviewpipe.core.model.finding.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts review-service payloads into findings. Entries missing a required string field
 * or carrying an unknown severity/type tag are skipped, not reported as errors.
 */
public class FindingsResponseParser {
    private static final Logger log = LoggerFactory.getLogger(FindingsResponseParser.class);

    private static final Pattern JSON_ARRAY_PATTERN = Pattern.compile("\\[[\\s\\S]*]");
    private static final String[] REQUIRED_FIELDS = {"type", "severity", "category", "message", "file"};

    private final ObjectMapper objectMapper;

    public FindingsResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse the first JSON array embedded in free text, e.g. a model answer wrapped in prose or fences.
     *
     * @throws StageFailureException if no array is present or it is not valid JSON
     */
    public List<Finding> parseFindingsFromText(String stageName, String text) {
        if (text == null) {
            throw new StageFailureException(stageName, "response text is empty");
        }
        Matcher matcher = JSON_ARRAY_PATTERN.matcher(text);
        if (!matcher.find()) {
            throw new StageFailureException(stageName, "no JSON array found in response text");
        }
        JsonNode array;
        try {
            array = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new StageFailureException(stageName, "response array is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parseFindings(stageName, array);
    }

    /**
     * @throws StageFailureException if the node is not an array
     */
    public List<Finding> parseFindings(String stageName, JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new StageFailureException(stageName, "findings payload is not an array");
        }

        List<Finding> findings = new ArrayList<>();
        for (JsonNode node : array) {
            Finding finding = toFinding(node);
            if (finding != null) {
                findings.add(finding);
            } else {
                log.debug("Stage '{}' skipped invalid finding entry: {}", stageName, node);
            }
        }
        return findings;
    }

    public TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return null;
        }
        int prompt = usage.path("promptTokens").asInt(0);
        int completion = usage.path("completionTokens").asInt(0);
        int total = usage.path("totalTokens").asInt(prompt + completion);
        return new TokenUsage(prompt, completion, total);
    }

    private Finding toFinding(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : REQUIRED_FIELDS) {
            if (!node.path(field).isTextual()) {
                return null;
            }
        }

        FindingType type;
        Severity severity;
        try {
            type = FindingType.fromValue(node.get("type").asText());
            severity = Severity.fromValue(node.get("severity").asText());
        } catch (IllegalArgumentException e) {
            return null;
        }

        return new Finding(
                type,
                severity,
                node.get("category").asText(),
                node.get("message").asText(),
                node.get("file").asText(),
                lineOf(node.get("line")),
                textOrNull(node.get("suggestion")),
                textOrNull(node.get("code"))
        );
    }

    private static Integer lineOf(JsonNode line) {
        if (line == null || line.isNull()) {
            return null;
        }
        if (line.isIntegralNumber()) {
            return line.asInt() > 0 ? line.asInt() : null;
        }
        if (line.isTextual()) {
            try {
                int parsed = Integer.parseInt(line.asText().trim());
                return parsed > 0 ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
