package de.mirkosertic.profileranker.pipeline;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.query.RetrievalQuery;
import de.mirkosertic.profileranker.scoring.LexicalScore;

import java.util.List;

/**
 * A validated ranking request with its filtered pool already in lexical order. The progressive
 * ranker fetches its waves from {@link #lexicalOrder()}.
 */
public record PreparedRanking(
        QueryBundle bundle,
        RankingConfig config,
        RetrievalQuery retrievalQuery,
        int poolSize,
        int filteredCount,
        List<LexicalScore> lexicalOrder
) {

    public PreparedRanking {
        lexicalOrder = List.copyOf(lexicalOrder);
    }
}
