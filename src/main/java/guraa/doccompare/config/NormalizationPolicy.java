package guraa.doccompare.config;

import lombok.Builder;
import lombok.Value;

/**
 * How tokens are normalized before they are compared.
 */
@Value
@Builder
public class NormalizationPolicy {

    @Builder.Default
    boolean caseFolding = true;

    @Builder.Default
    boolean collapseWhitespace = true;

    @Builder.Default
    boolean stripPunctuation = false;

    public static NormalizationPolicy defaults() {
        return NormalizationPolicy.builder().build();
    }

    public static NormalizationPolicy exact() {
        return new NormalizationPolicy(false, false, false);
    }
}
