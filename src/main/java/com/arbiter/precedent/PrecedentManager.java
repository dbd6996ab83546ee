package com.arbiter.precedent;

import com.arbiter.contract.RuleCategory;
import com.arbiter.contract.ViolationSeverity;
import com.arbiter.verdict.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Store-backed precedent registry with similarity retrieval.
 *
 * Similarity of a stored precedent to a query:
 * <pre>
 *   0.40 x category match
 * + 0.20 x severity proximity (1 - rank distance / max distance)
 * + 0.25 x fraction of query keywords found in title, key facts and reasoning
 * + 0.15 x fraction of query rule ids among the rules involved
 * </pre>
 * Matches below {@code minSimilarity} are dropped; ties go to the most
 * recently created precedent.
 */
public class PrecedentManager {

    private static final Logger log = LoggerFactory.getLogger(PrecedentManager.class);

    static final double CATEGORY_WEIGHT = 0.40;
    static final double SEVERITY_WEIGHT = 0.20;
    static final double KEYWORD_WEIGHT = 0.25;
    static final double RULE_WEIGHT = 0.15;

    public static final double DEFAULT_MIN_SIMILARITY = 0.3;

    private static final Comparator<PrecedentMatch> BY_SIMILARITY_THEN_RECENCY =
        Comparator.comparingDouble(PrecedentMatch::similarity).reversed()
            .thenComparing(Comparator.comparingLong((PrecedentMatch m) -> m.precedent().sequence()).reversed());

    private final PrecedentStore store;
    private final double minSimilarity;
    private final Clock clock;
    private final ConcurrentHashMap<String, LongAdder> citations = new ConcurrentHashMap<>();

    public PrecedentManager() {
        this(new InMemoryPrecedentStore(), DEFAULT_MIN_SIMILARITY);
    }

    public PrecedentManager(PrecedentStore store, double minSimilarity) {
        this(store, minSimilarity, Clock.systemUTC());
    }

    public PrecedentManager(PrecedentStore store, double minSimilarity, Clock clock) {
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be within [0, 1]: " + minSimilarity);
        }
        this.store = store;
        this.minSimilarity = minSimilarity;
        this.clock = clock;
    }

    /**
     * Creates and stores a precedent. The precedent is fully built before it
     * is appended, so concurrent lookups either see all of it or none of it.
     */
    public Precedent createPrecedent(Verdict verdict,
                                     String title,
                                     List<String> keyFacts,
                                     String reasoningSummary,
                                     PrecedentApplicability applicability) {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict is required to create a precedent");
        }
        if (applicability == null || applicability.category() == null) {
            throw new IllegalArgumentException("precedent applicability requires a category");
        }
        long sequence = store.nextSequence();
        Precedent precedent = new Precedent(
            "PREC-" + sequence,
            title,
            keyFacts,
            reasoningSummary,
            verdict.rulesApplied(),
            applicability,
            verdict,
            clock.instant(),
            sequence
        );
        store.append(precedent);
        log.info("Created precedent {} '{}' from verdict {} (category={}, severity={})",
            precedent.id(), title, verdict.id(), applicability.category(), applicability.severity());
        return precedent;
    }

    /**
     * Ranks stored precedents against the query.
     *
     * @param descriptionKeywords free text; split into keywords
     * @param limit               maximum number of matches returned
     */
    public List<PrecedentMatch> findSimilarPrecedents(RuleCategory category,
                                                      ViolationSeverity severity,
                                                      List<String> descriptionKeywords,
                                                      List<String> ruleIds,
                                                      int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Set<String> queryKeywords = KeywordExtractor.keywords(
            descriptionKeywords == null ? List.of() : descriptionKeywords);
        Set<String> queryRules = ruleIds == null ? Set.of() : new HashSet<>(ruleIds);

        List<PrecedentMatch> matches = new ArrayList<>();
        for (Precedent precedent : store.findAll()) {
            PrecedentMatch match = score(precedent, category, severity, queryKeywords, queryRules);
            if (match.similarity() >= minSimilarity && match.similarity() > 0.0) {
                matches.add(match);
            }
        }
        matches.sort(BY_SIMILARITY_THEN_RECENCY);
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
    }

    private PrecedentMatch score(Precedent precedent,
                                 RuleCategory category,
                                 ViolationSeverity severity,
                                 Set<String> queryKeywords,
                                 Set<String> queryRules) {
        List<String> reasons = new ArrayList<>();
        PrecedentApplicability applicability = precedent.applicability();
        double similarity = 0.0;

        if (category != null && category == applicability.category()) {
            similarity += CATEGORY_WEIGHT;
            reasons.add("category " + category.getValue());
        }

        if (severity != null && applicability.severity() != null) {
            int distance = severity.distanceTo(applicability.severity());
            double proximity = 1.0 - (double) distance / ViolationSeverity.maxDistance();
            similarity += SEVERITY_WEIGHT * proximity;
            if (distance == 0) {
                reasons.add("severity " + severity.getValue());
            }
        }

        if (!queryKeywords.isEmpty()) {
            List<String> texts = new ArrayList<>(precedent.keyFacts());
            texts.add(precedent.title());
            texts.add(precedent.reasoningSummary());
            Set<String> precedentKeywords = KeywordExtractor.keywords(texts);
            long shared = queryKeywords.stream().filter(precedentKeywords::contains).count();
            if (shared > 0) {
                similarity += KEYWORD_WEIGHT * shared / queryKeywords.size();
                reasons.add(shared + " shared keywords");
            }
        }

        if (!queryRules.isEmpty()) {
            long shared = precedent.rulesInvolved().stream().filter(queryRules::contains).distinct().count();
            if (shared > 0) {
                similarity += RULE_WEIGHT * shared / queryRules.size();
                reasons.add(shared + " shared rules");
            }
        }

        return new PrecedentMatch(precedent, Math.round(Math.min(1.0, similarity) * 10_000.0) / 10_000.0, reasons);
    }

    /** Exact-filter browse, most recent first. */
    public List<Precedent> searchPrecedents(PrecedentSearchCriteria criteria) {
        return store.findAll().stream()
            .filter(p -> criteria.categories().isEmpty()
                || criteria.categories().contains(p.applicability().category()))
            .filter(p -> criteria.severities().isEmpty()
                || criteria.severities().contains(p.applicability().severity()))
            .filter(p -> criteria.ruleIds().isEmpty()
                || p.rulesInvolved().stream().anyMatch(criteria.ruleIds()::contains))
            .filter(p -> criteria.keyword() == null || criteria.keyword().isBlank()
                || matchesKeyword(p, criteria.keyword()))
            .sorted(Comparator.comparingLong(Precedent::sequence).reversed())
            .limit(criteria.limit())
            .toList();
    }

    private boolean matchesKeyword(Precedent precedent, String keyword) {
        Set<String> wanted = KeywordExtractor.keywords(List.of(keyword));
        List<String> texts = new ArrayList<>(precedent.keyFacts());
        texts.add(precedent.title());
        texts.add(precedent.reasoningSummary());
        return KeywordExtractor.keywords(texts).containsAll(wanted);
    }

    public Optional<Precedent> getPrecedent(String precedentId) {
        return store.findById(precedentId);
    }

    /** Records that a session relied on the precedent. Unknown ids are ignored. */
    public void cite(String precedentId) {
        if (store.findById(precedentId).isPresent()) {
            citations.computeIfAbsent(precedentId, id -> new LongAdder()).increment();
        }
    }

    public long citationCount(String precedentId) {
        LongAdder count = citations.get(precedentId);
        return count == null ? 0 : count.sum();
    }

    public PrecedentStatistics getStatistics() {
        List<Precedent> all = store.findAll();
        Map<RuleCategory, Long> byCategory = new EnumMap<>(RuleCategory.class);
        Map<ViolationSeverity, Long> bySeverity = new EnumMap<>(ViolationSeverity.class);
        for (Precedent precedent : all) {
            byCategory.merge(precedent.applicability().category(), 1L, Long::sum);
            if (precedent.applicability().severity() != null) {
                bySeverity.merge(precedent.applicability().severity(), 1L, Long::sum);
            }
        }
        long totalCitations = citations.values().stream().mapToLong(LongAdder::sum).sum();
        return new PrecedentStatistics(all.size(), byCategory, bySeverity, totalCitations);
    }

    public void clear() {
        store.clear();
        citations.clear();
    }
}
