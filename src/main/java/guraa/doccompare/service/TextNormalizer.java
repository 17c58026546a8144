package guraa.doccompare.service;

import guraa.doccompare.config.NormalizationPolicy;
import guraa.doccompare.model.Cell;
import guraa.doccompare.model.TextBlock;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw tokens into comparison tokens according to a {@link NormalizationPolicy}.
 * Pure: the same input always produces the same output.
 */
public class TextNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("\\p{P}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NormalizationPolicy policy;

    public TextNormalizer(NormalizationPolicy policy) {
        this.policy = policy != null ? policy : NormalizationPolicy.defaults();
    }

    public List<String> tokenize(TextBlock block) {
        return normalize(block.getTokens());
    }

    public List<String> tokenize(Cell cell) {
        return normalize(cell.getTokens());
    }

    /**
     * Normalize a token sequence.
     *
     * @param tokens The raw tokens, may be null
     * @return The normalized tokens; empty for empty input
     */
    public List<String> normalize(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> result = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (token == null) {
                continue;
            }
            if (policy.isCollapseWhitespace()) {
                for (String part : WHITESPACE.split(StringUtils.normalizeSpace(token))) {
                    addToken(result, part);
                }
            } else {
                addToken(result, token);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private void addToken(List<String> result, String token) {
        String value = token;
        if (policy.isStripPunctuation()) {
            value = PUNCTUATION.matcher(value).replaceAll("");
        }
        if (policy.isCaseFolding()) {
            value = value.toLowerCase(Locale.ROOT);
        }
        if (policy.isCollapseWhitespace() || policy.isStripPunctuation()) {
            if (StringUtils.isBlank(value)) {
                return;
            }
        } else if (value.isEmpty()) {
            return;
        }
        result.add(value);
    }
}
