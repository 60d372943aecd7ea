package de.mirkosertic.profileranker.telemetry;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.pipeline.RankingEngine;
import de.mirkosertic.profileranker.rescoring.ContributionKind;
import de.mirkosertic.profileranker.rescoring.MatchCategory;
import de.mirkosertic.profileranker.rescoring.RescoringStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CollectingRankingTelemetryTest {

    @Test
    void testCollectsEventsOfARankingCall() {
        final CollectingRankingTelemetry telemetry = new CollectingRankingTelemetry();
        final RankingEngine engine = new RankingEngine(RankingConfig.defaults(), telemetry);
        final List<Candidate> pool = List.of(
                Candidate.builder("ep").description("SVT ablation").build(),
                Candidate.builder("gp").description("general practice").build());

        engine.rank(pool, QueryBundle.builder("SVT").anchorPhrases("ablation").build(), 5);

        assertThat(telemetry.eventsFor("ep")).singleElement().satisfies(event -> {
            assertThat(event.category()).isEqualTo(MatchCategory.ANCHOR);
            assertThat(event.strategy()).isEqualTo(RescoringStrategy.TERM_BOOST);
            assertThat(event.kind()).isEqualTo(ContributionKind.ADDITIVE);
            assertThat(event.matches()).isEqualTo(1);
        });
        assertThat(telemetry.eventsFor("gp")).isEmpty();
        assertThat(telemetry.fallbacks()).isEmpty();

        telemetry.clear();
        assertThat(telemetry.events()).isEmpty();
    }

    @Test
    void testRecordsFallbacks() {
        final CollectingRankingTelemetry telemetry = new CollectingRankingTelemetry();
        final RankingEngine engine = new RankingEngine(RankingConfig.defaults(), telemetry);

        engine.rank(List.of(Candidate.builder("a").build()), QueryBundle.builder("SVT").build(), 5);

        assertThat(telemetry.fallbacks()).singleElement()
                .extracting(CollectingRankingTelemetry.Fallback::resolved)
                .isEqualTo(RescoringStrategy.LEXICAL_ONLY);
    }

    @Test
    void testSlf4jTelemetryAcceptsEvents() {
        final RankingEngine engine = new RankingEngine();

        assertThat(engine.rank(List.of(Candidate.builder("a").description("ablation").build()),
                QueryBundle.builder("ablation").anchorPhrases("ablation").build(), 1).results()).hasSize(1);
    }
}
