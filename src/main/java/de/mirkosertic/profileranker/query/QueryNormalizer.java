package de.mirkosertic.profileranker.query;

import de.mirkosertic.profileranker.analysis.PhraseMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Expands a query with a small, fixed allow-list of equivalences.
 *
 * <p>The table only holds true equivalences: abbreviations and their expansions, and British and
 * American spellings. It is not a synonym dictionary and never introduces a term with a different
 * meaning. The original text is always kept; expansions are appended.</p>
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>matching is case-insensitive, punctuation and hyphens count as spaces, and terms must match
 *       on word boundaries</li>
 *   <li>context-gated aliases only fire when one of their companion words is present</li>
 *   <li>at most {@value #MAX_ALIASES} aliases are applied; longer matched terms win, then the
 *       priority tier, then table order</li>
 *   <li>an alias whose expansion is already present in the query (or was added by an earlier alias)
 *       is skipped and does not count towards the limit</li>
 * </ul>
 */
public class QueryNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryNormalizer.class);

    public static final int MAX_ALIASES = 2;

    private static final List<String> CARDIAC_CONTEXT = List.of("cardiac", "heart", "cardiology", "cardiologist", "cardio");

    static final List<AliasRule> DEFAULT_RULES = defaultRules();

    private static List<AliasRule> defaultRules() {
        final List<AliasRule> rules = new ArrayList<>();
        rules.addAll(AliasRule.bidirectional("svt", "supraventricular tachycardia"));
        rules.addAll(AliasRule.bidirectional("afib", "atrial fibrillation"));
        // "af" is too short to be appended on its own; only the forward direction exists
        rules.add(AliasRule.of("af", "atrial fibrillation"));
        rules.addAll(AliasRule.bidirectional("ctca", "ct coronary angiography"));
        rules.addAll(AliasRule.bidirectional("pci", "percutaneous coronary intervention"));
        rules.addAll(AliasRule.bidirectional("tavi", "transcatheter aortic valve implantation"));
        rules.addAll(AliasRule.bidirectional("icd", "implantable cardioverter defibrillator"));
        rules.addAll(AliasRule.bidirectional("ischaemic", "ischemic"));
        rules.addAll(AliasRule.bidirectional("oesophageal", "esophageal"));
        rules.addAll(AliasRule.bidirectional("anaesthesia", "anesthesia"));
        rules.add(new AliasRule("echo", "echocardiogram", CARDIAC_CONTEXT, AliasRule.Priority.LOW));
        return List.copyOf(rules);
    }

    private final List<AliasRule> rules;

    public QueryNormalizer() {
        this(DEFAULT_RULES);
    }

    public QueryNormalizer(final List<AliasRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public NormalizedQuery normalize(final String query) {
        final String original = query == null ? "" : query.trim();
        if (original.isEmpty()) {
            return NormalizedQuery.unchanged(original);
        }

        final String canonical = PhraseMatcher.normalize(original);

        final List<Integer> matching = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).matches(canonical)) {
                matching.add(i);
            }
        }
        if (matching.isEmpty()) {
            return NormalizedQuery.unchanged(original);
        }

        matching.sort(Comparator
                .comparingInt((Integer i) -> -rules.get(i).term().length())
                .thenComparing(i -> rules.get(i).priority())
                .thenComparingInt(i -> i));

        final List<NormalizedQuery.AppliedAlias> applied = new ArrayList<>();
        final StringBuilder present = new StringBuilder(canonical);
        for (final int index : matching) {
            if (applied.size() >= MAX_ALIASES) {
                break;
            }
            final AliasRule rule = rules.get(index);
            if (PhraseMatcher.containsWholePhrase(present.toString(), rule.expansion())) {
                continue;
            }
            applied.add(new NormalizedQuery.AppliedAlias(rule.term(), rule.expansion()));
            present.append(' ').append(rule.expansion());
        }

        if (applied.isEmpty()) {
            return NormalizedQuery.unchanged(original);
        }

        final StringBuilder normalized = new StringBuilder(original);
        for (final NormalizedQuery.AppliedAlias alias : applied) {
            normalized.append(' ').append(alias.expansion());
        }
        logger.debug("Query '{}' expanded with aliases {}", original, applied);
        return new NormalizedQuery(original, normalized.toString(), applied);
    }
}
