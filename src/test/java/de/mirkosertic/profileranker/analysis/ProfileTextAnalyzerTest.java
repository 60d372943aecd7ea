package de.mirkosertic.profileranker.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ProfileTextAnalyzer}.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> LengthFilter(3)}</p>
 */
@DisplayName("ProfileTextAnalyzer")
class ProfileTextAnalyzerTest {

    private final ProfileTextAnalyzer analyzer = new ProfileTextAnalyzer();

    @Test
    @DisplayName("Lower-cases and drops tokens shorter than three characters")
    void testLowerCaseAndShortTokens() {
        assertThat(analyzer.tokenize("Atrial Fibrillation, AF & SVT"))
                .containsExactly("atrial", "fibrillation", "svt");
    }

    @Test
    @DisplayName("Folds diacritics")
    void testDiacriticFolding() {
        assertThat(analyzer.tokenize("Café Électrophysiologie"))
                .containsExactly("cafe", "electrophysiologie");
    }

    @Test
    @DisplayName("Keeps duplicates in order")
    void testDuplicatesKept() {
        assertThat(analyzer.tokenize("ablation Ablation ABLATION"))
                .containsExactly("ablation", "ablation", "ablation");
    }

    @Test
    @DisplayName("Does not stem")
    void testNoStemming() {
        assertThat(analyzer.tokenize("ablations ablation"))
                .containsExactly("ablations", "ablation");
    }

    @Test
    void testBlankInput() {
        assertThat(analyzer.tokenize("")).isEmpty();
        assertThat(analyzer.tokenize("   ")).isEmpty();
        assertThat(analyzer.tokenize(null)).isEmpty();
    }
}
