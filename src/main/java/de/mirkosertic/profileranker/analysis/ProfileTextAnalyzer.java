package de.mirkosertic.profileranker.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyzer used for both the projected profile text and the retrieval query.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> LengthFilter(3)}</p>
 *
 * <p>Tokens of one or two characters are dropped. Short abbreviations such as "af" therefore never
 * reach the lexical scorer on their own, which is why the query normalizer appends their expansions.
 * No stemming is applied: "ablation" and "ablations" are different terms, matching the exact-term
 * behavior the rescoring vocabularies are tuned against.</p>
 */
public class ProfileTextAnalyzer extends Analyzer {

    public static final int MIN_TOKEN_LENGTH = 3;

    private static final String FIELD_NAME = "profile";

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        stream = new LengthFilter(stream, MIN_TOKEN_LENGTH, Integer.MAX_VALUE);
        return new TokenStreamComponents(tokenizer, stream);
    }

    /**
     * Runs {@code text} through this analyzer and returns the tokens in order, duplicates included.
     */
    public List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        try (final TokenStream tokenStream = tokenStream(FIELD_NAME, text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            tokenStream.end();
        } catch (final IOException e) {
            // Reading from an in-memory string, so this only happens on analyzer bugs
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return tokens;
    }
}
