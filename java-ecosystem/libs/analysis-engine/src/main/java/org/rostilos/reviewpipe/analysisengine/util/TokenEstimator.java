package org.rostilos.reviewpipe.analysisengine.util;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token counting for stage prompts, using the cl100k_base encoding.
 */
public final class TokenEstimator {
    private static final Logger log = LoggerFactory.getLogger(TokenEstimator.class);

    private static final Encoding ENCODING =
            Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);

    private TokenEstimator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return estimated token count, 0 for null or empty text
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        try {
            return ENCODING.countTokens(text);
        } catch (RuntimeException e) {
            log.warn("Failed to count tokens, falling back to length / 4: {}", e.getMessage());
            return text.length() / 4;
        }
    }

    /**
     * Estimate and compare against a budget. A budget of zero or less means unlimited.
     */
    public static TokenEstimationResult estimateAndCheck(String text, int maxTokens) {
        int estimated = estimateTokens(text);
        boolean limited = maxTokens > 0;
        return new TokenEstimationResult(
                estimated,
                maxTokens,
                limited && estimated > maxTokens,
                limited ? estimated * 100.0 / maxTokens : 0
        );
    }

    public record TokenEstimationResult(
            int estimatedTokens,
            int maxAllowedTokens,
            boolean exceedsLimit,
            double utilizationPercentage
    ) {
        public String toLogString() {
            if (maxAllowedTokens <= 0) {
                return String.format("Tokens: %d (no limit)", estimatedTokens);
            }
            return String.format("Tokens: %d / %d (%.1f%%) - %s",
                    estimatedTokens, maxAllowedTokens, utilizationPercentage,
                    exceedsLimit ? "EXCEEDS LIMIT" : "within limit");
        }
    }
}
