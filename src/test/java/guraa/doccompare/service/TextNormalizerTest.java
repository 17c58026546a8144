package guraa.doccompare.service;

import guraa.doccompare.config.NormalizationPolicy;
import guraa.doccompare.model.Cell;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    @Test
    void defaultPolicyFoldsCaseAndCollapsesWhitespace() {
        TextNormalizer normalizer = new TextNormalizer(NormalizationPolicy.defaults());

        assertEquals(List.of("width:", "10mm", "total"),
                normalizer.normalize(Arrays.asList("Width:", "  10MM ", "", "\t", null, "Total")));
    }

    @Test
    void innerWhitespaceSplitsTokens() {
        TextNormalizer normalizer = new TextNormalizer(null);

        assertEquals(List.of("acme", "pro"), normalizer.tokenize(new Cell(List.of("Acme  Pro"), false, null)));
        assertEquals(List.of("acme", "pro"), normalizer.normalize(List.of(" Acme   Pro ")));
    }

    @Test
    void punctuationStrippingDropsEmptiedTokens() {
        TextNormalizer normalizer = new TextNormalizer(NormalizationPolicy.builder().stripPunctuation(true).build());

        assertEquals(List.of("hello", "world"), normalizer.normalize(List.of("Hello,", "--", "world!")));
    }

    @Test
    void exactPolicyKeepsTokens() {
        TextNormalizer normalizer = new TextNormalizer(NormalizationPolicy.exact());

        assertEquals(List.of("Hello,", "World"), normalizer.normalize(List.of("Hello,", "World", "")));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        TextNormalizer normalizer = new TextNormalizer(NormalizationPolicy.defaults());

        assertTrue(normalizer.normalize(List.of()).isEmpty());
        assertTrue(normalizer.normalize(null).isEmpty());
    }
}
