package de.mirkosertic.profileranker.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every scoring event to the log at DEBUG level.
 */
public class Slf4jRankingTelemetry implements RankingTelemetry {

    private static final Logger logger = LoggerFactory.getLogger(Slf4jRankingTelemetry.class);

    @Override
    public void onScoringEvent(final ScoringEvent event) {
        if (logger.isDebugEnabled()) {
            logger.debug("candidate={} strategy={} category={} matches={} contribution={} kind={}",
                    event.candidateId(), event.strategy(), event.category(), event.matches(),
                    String.format("%.4f", event.contribution()), event.kind());
        }
    }
}
