package de.mirkosertic.profileranker.query;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.model.QueryBundle;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalQueryBuilderTest {

    private final RetrievalQueryBuilder builder = new RetrievalQueryBuilder(new QueryNormalizer());

    @Test
    void testSafeLaneTermsAreCappedAndAnchorsAppended() {
        final QueryBundle bundle = QueryBundle.builder("chest pain")
                .safeLaneTerms("cardiologist", "angina", "", "heart", "palpitations", "syncope")
                .anchorPhrases("chest pain clinic")
                .build();

        final RetrievalQuery query = builder.build(bundle, RankingConfig.defaults());

        assertThat(query.safeLaneTermsUsed()).containsExactly("cardiologist", "angina", "heart", "palpitations");
        assertThat(query.text()).isEqualTo("chest pain cardiologist angina heart palpitations chest pain clinic");
        assertThat(query.anchorPhrasesAppended()).containsExactly("chest pain clinic");
        assertThat(query.isTwoQuery()).isFalse();
    }

    @Test
    void testIntentTermsStayOutOfRetrievalByDefault() {
        final QueryBundle bundle = QueryBundle.builder("palpitations")
                .intentTerms("supraventricular tachycardia", "ablation")
                .build();

        final RetrievalQuery query = builder.build(bundle, RankingConfig.defaults());

        assertThat(query.text()).isEqualTo("palpitations");
        assertThat(query.intentTermsInjected()).isEmpty();
    }

    @Test
    void testIntentTermsInjectedWhenEnabled() {
        final QueryBundle bundle = QueryBundle.builder("palpitations")
                .intentTerms("ablation", "electrophysiology", "holter")
                .build();
        final RankingConfig config = RankingConfig.defaults().withOverrides(Map.of(
                "intent-terms-in-retrieval", true,
                "intent-terms-in-retrieval-max", 2));

        final RetrievalQuery query = builder.build(bundle, config);

        assertThat(query.intentTermsInjected()).containsExactly("ablation", "electrophysiology");
        assertThat(query.text()).isEqualTo("palpitations ablation electrophysiology");
    }

    @Test
    void testTwoQueryModeBuildsSeparateIntentQuery() {
        final QueryBundle bundle = QueryBundle.builder("racing heart")
                .intentTerms("svt", "ablation")
                .build();
        final RankingConfig config = RankingConfig.defaults().withOverrides(Map.of(
                "stage-a-two-query", true,
                "intent-terms-in-retrieval", true));

        final RetrievalQuery query = builder.build(bundle, config);

        assertThat(query.isTwoQuery()).isTrue();
        assertThat(query.intentQuery()).isEqualTo("svt ablation supraventricular tachycardia");
        assertThat(query.text()).isEqualTo("racing heart");
        assertThat(query.intentTermsInjected()).isEmpty();
    }

    @Test
    void testNameHintIsNormalizedWithTheQuery() {
        final QueryBundle bundle = QueryBundle.builder("svt").nameHint("Dr Smith").build();

        final RetrievalQuery query = builder.build(bundle, RankingConfig.defaults());

        assertThat(query.text()).isEqualTo("svt Dr Smith supraventricular tachycardia");
        assertThat(query.normalization().original()).isEqualTo("svt Dr Smith");
    }
}
