package com.clinicdocs.search.matching;

import com.clinicdocs.search.config.SearchProperties;
import com.clinicdocs.search.model.MatchType;
import com.clinicdocs.search.model.SimilarityMatch;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scores a normalized query against a normalized candidate name.
 * <p>
 * Strategies are tried from highest to lowest fidelity and the first one that applies wins.
 * Each strategy owns a score band so a higher-fidelity match always outranks a lower one:
 * <ul>
 *     <li>exact: 1.0</li>
 *     <li>prefix: (0.8, 1.0)</li>
 *     <li>substring: (0.6, 0.85)</li>
 *     <li>fuzzy: [0.3, 0.7]</li>
 *     <li>text search: (0.3, 0.45)</li>
 * </ul>
 * Pairs that match no strategy yield no score at all.
 */
@Component
public class SimilarityScorer {

    static final double PREFIX_FLOOR = 0.8;
    static final double PREFIX_SPAN = 0.2;
    static final double SUBSTRING_FLOOR = 0.6;
    static final double SUBSTRING_SPAN = 0.25;
    static final double FUZZY_MIN = 0.3;
    static final double FUZZY_MAX = 0.7;
    static final double TEXT_SEARCH_FLOOR = 0.3;
    static final double TEXT_SEARCH_SPAN = 0.15;

    private final NameNormalizer normalizer;
    private final double fuzzyCharThreshold;
    private final double fuzzyTokenThreshold;
    private final int minReversePrefixLength;

    public SimilarityScorer(NameNormalizer normalizer, SearchProperties properties) {
        this.normalizer = normalizer;
        this.fuzzyCharThreshold = properties.similarity().fuzzyCharThreshold();
        this.fuzzyTokenThreshold = properties.similarity().fuzzyTokenThreshold();
        this.minReversePrefixLength = properties.similarity().minReversePrefixLength();
    }

    public Optional<SimilarityMatch> score(String query, String candidate) {
        return score(query, candidate, EnumSet.allOf(MatchType.class));
    }

    /**
     * Same as {@link #score(String, String)} but only the given strategies are considered.
     */
    public Optional<SimilarityMatch> score(String query, String candidate, Set<MatchType> allowed) {
        if (query == null || candidate == null || query.isEmpty() || candidate.isEmpty()) {
            return Optional.empty();
        }

        if (query.equals(candidate)) {
            return allowed.contains(MatchType.EXACT)
                ? Optional.of(new SimilarityMatch(1.0, MatchType.EXACT))
                : Optional.empty();
        }

        if (allowed.contains(MatchType.PREFIX)) {
            Optional<SimilarityMatch> prefix = prefix(query, candidate);
            if (prefix.isPresent()) {
                return prefix;
            }
        }

        if (allowed.contains(MatchType.SUBSTRING) && candidate.contains(query)) {
            double ratio = (double) query.length() / candidate.length();
            return Optional.of(new SimilarityMatch(SUBSTRING_FLOOR + SUBSTRING_SPAN * ratio, MatchType.SUBSTRING));
        }

        List<String> queryTokens = normalizer.tokens(query);
        List<String> candidateTokens = normalizer.tokens(candidate);

        if (allowed.contains(MatchType.FUZZY)) {
            Optional<SimilarityMatch> fuzzy = fuzzy(query, candidate, queryTokens, candidateTokens);
            if (fuzzy.isPresent()) {
                return fuzzy;
            }
        }

        if (allowed.contains(MatchType.TEXT_SEARCH)) {
            return textSearch(queryTokens, candidateTokens);
        }
        return Optional.empty();
    }

    private Optional<SimilarityMatch> prefix(String query, String candidate) {
        if (candidate.startsWith(query)) {
            double ratio = (double) query.length() / candidate.length();
            return Optional.of(new SimilarityMatch(PREFIX_FLOOR + PREFIX_SPAN * ratio, MatchType.PREFIX));
        }
        if (candidate.length() >= minReversePrefixLength && query.startsWith(candidate)) {
            double ratio = (double) candidate.length() / query.length();
            return Optional.of(new SimilarityMatch(PREFIX_FLOOR + PREFIX_SPAN * ratio, MatchType.PREFIX));
        }
        return Optional.empty();
    }

    private Optional<SimilarityMatch> fuzzy(String query, String candidate,
                                            List<String> queryTokens, List<String> candidateTokens) {
        double best = -1;

        double charSimilarity = similarity(query, candidate);
        if (charSimilarity >= fuzzyCharThreshold) {
            best = charSimilarity;
        }

        double tokenSimilarity = tokenSimilarity(queryTokens, candidateTokens);
        if (tokenSimilarity >= 0) {
            best = Math.max(best, tokenSimilarity);
        }

        // the fuzzy band is open at its floor, weaker alignments fall through to text search
        if (best <= FUZZY_MIN) {
            return Optional.empty();
        }
        return Optional.of(new SimilarityMatch(Math.min(FUZZY_MAX, best), MatchType.FUZZY));
    }

    /**
     * Aligns every query token to a distinct candidate token. Returns -1 when some query token has
     * no candidate token close enough; otherwise one minus the total edit cost, where candidate
     * tokens left unmatched count with their full length.
     */
    private double tokenSimilarity(List<String> queryTokens, List<String> candidateTokens) {
        if (queryTokens.isEmpty() || queryTokens.size() > candidateTokens.size()) {
            return -1;
        }

        boolean[] used = new boolean[candidateTokens.size()];
        int cost = 0;
        for (String queryToken : queryTokens) {
            int bestIndex = -1;
            int bestDistance = Integer.MAX_VALUE;
            for (int i = 0; i < candidateTokens.size(); i++) {
                if (used[i]) {
                    continue;
                }
                String candidateToken = candidateTokens.get(i);
                int distance = levenshtein(queryToken, candidateToken);
                double tokenScore = 1.0 - (double) distance / Math.max(queryToken.length(), candidateToken.length());
                if (tokenScore >= fuzzyTokenThreshold && distance < bestDistance) {
                    bestIndex = i;
                    bestDistance = distance;
                }
            }
            if (bestIndex < 0) {
                return -1;
            }
            used[bestIndex] = true;
            cost += bestDistance;
        }

        int queryLength = 0;
        for (String token : queryTokens) {
            queryLength += token.length();
        }
        int candidateLength = 0;
        for (int i = 0; i < candidateTokens.size(); i++) {
            candidateLength += candidateTokens.get(i).length();
            if (!used[i]) {
                cost += candidateTokens.get(i).length();
            }
        }
        return Math.max(0.0, 1.0 - (double) cost / Math.max(queryLength, candidateLength));
    }

    private Optional<SimilarityMatch> textSearch(List<String> queryTokens, List<String> candidateTokens) {
        Set<String> candidateSet = new HashSet<>(candidateTokens);
        Set<String> shared = new HashSet<>(queryTokens);
        shared.retainAll(candidateSet);
        if (shared.isEmpty()) {
            return Optional.empty();
        }
        double distinctQueryTokens = new HashSet<>(queryTokens).size();
        double score = TEXT_SEARCH_FLOOR + TEXT_SEARCH_SPAN * shared.size() / (distinctQueryTokens + 1);
        return Optional.of(new SimilarityMatch(score, MatchType.TEXT_SEARCH));
    }

    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
