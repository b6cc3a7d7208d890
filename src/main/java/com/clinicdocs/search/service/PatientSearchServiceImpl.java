package com.clinicdocs.search.service;

import com.clinicdocs.search.config.SearchProperties;
import com.clinicdocs.search.exception.ValidationException;
import com.clinicdocs.search.matching.NameNormalizer;
import com.clinicdocs.search.matching.SimilarityScorer;
import com.clinicdocs.search.model.DocumentFilter;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.MatchType;
import com.clinicdocs.search.model.NameSuggestion;
import com.clinicdocs.search.model.PatientSearchQuery;
import com.clinicdocs.search.model.PatientSearchResult;
import com.clinicdocs.search.model.ScoredDocument;
import com.clinicdocs.search.model.SimilarityMatch;
import com.clinicdocs.search.model.SuggestionResult;
import com.clinicdocs.search.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Fuzzy patient-name search over stored documents.
 * <p>
 * Candidates are fetched with cheap indexed filters, scored in memory by {@link SimilarityScorer}
 * and ranked with {@link ScoredDocument#RANKING}, so pages over an unchanged dataset never
 * overlap or skip documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatientSearchServiceImpl implements PatientSearchService {

    private static final Set<MatchType> ALL_STRATEGIES = EnumSet.allOf(MatchType.class);
    private static final Set<MatchType> SUGGESTION_STRATEGIES = EnumSet.of(MatchType.EXACT, MatchType.PREFIX, MatchType.SUBSTRING);
    private static final Set<MatchType> PATIENT_DOCUMENT_STRATEGIES = EnumSet.of(MatchType.EXACT, MatchType.PREFIX);
    private static final int DEFAULT_SUGGESTIONS = 10;

    private final DocumentRepository documentRepository;
    private final NameNormalizer nameNormalizer;
    private final SimilarityScorer similarityScorer;
    private final SearchProperties properties;
    private final Clock clock;

    @Override
    public PatientSearchResult searchPatients(PatientSearchQuery query) {
        validateTerm(query.searchTerm());
        int limit = validateLimit(query.limit());
        int skip = validateSkip(query.skip());
        double minSimilarity = validateMinSimilarity(query.minSimilarity());
        String normalized = normalizeTerm(query.searchTerm());

        log.debug("Searching patients for '{}' (owner {}, min {}, limit {}, skip {})",
            normalized, query.ownerUserId(), minSimilarity, limit, skip);

        List<ScoredDocument> ranked = rank(normalized, fetchCandidates(normalized, query.ownerUserId()), minSimilarity, ALL_STRATEGIES);
        return page(query.searchTerm(), normalized, ranked, limit, skip, minSimilarity);
    }

    @Override
    public PatientSearchResult documentsForPatient(String patientName, String ownerUserId, Integer limit, Integer skip) {
        validateTerm(patientName);
        int pageLimit = validateLimit(limit);
        int pageSkip = validateSkip(skip);
        String normalized = normalizeTerm(patientName);
        double minSimilarity = properties.patientDocumentsMinSimilarity();

        DocumentFilter named = DocumentFilter.namedDocuments(ownerUserId);
        Map<UUID, DocumentRecord> found = new LinkedHashMap<>();
        collect(found, named.toBuilder().namePrefix(normalized).build(), properties.candidateLimit());
        collect(found, named.toBuilder().namePrefixOf(normalized).build(), properties.candidateLimit());
        List<DocumentRecord> candidates = new ArrayList<>(found.values());

        List<ScoredDocument> ranked = rank(normalized, candidates, minSimilarity, PATIENT_DOCUMENT_STRATEGIES);
        return page(patientName, normalized, ranked, pageLimit, pageSkip, minSimilarity);
    }

    @Override
    public SuggestionResult suggestPatientNames(String partialTerm, String ownerUserId, Integer limit) {
        validateTerm(partialTerm);
        int max = limit == null ? Math.min(DEFAULT_SUGGESTIONS, properties.maxSuggestions()) : limit;
        if (max < 1 || max > properties.maxSuggestions()) {
            throw new ValidationException("limit must be between 1 and " + properties.maxSuggestions());
        }
        String normalized = normalizeTerm(partialTerm);

        DocumentFilter named = DocumentFilter.namedDocuments(ownerUserId);
        Map<UUID, DocumentRecord> candidates = new LinkedHashMap<>();
        collect(candidates, named.toBuilder().nameContains(normalized).build(), properties.suggestionCandidateLimit());
        collect(candidates, named.toBuilder().namePrefixOf(normalized).build(), properties.suggestionCandidateLimit());

        Map<String, NameSuggestion> byName = new LinkedHashMap<>();
        for (DocumentRecord candidate : candidates.values()) {
            String name = candidate.normalizedPatientName();
            similarityScorer.score(normalized, name, SUGGESTION_STRATEGIES).ifPresent(match ->
                byName.merge(name,
                    new NameSuggestion(name, match.score(), match.matchType(), 1),
                    (current, added) -> new NameSuggestion(name, current.score(), current.matchType(), current.documentCount() + 1)));
        }

        List<NameSuggestion> suggestions = byName.values().stream()
            .sorted(Comparator.comparingDouble(NameSuggestion::score).reversed()
                .thenComparing(Comparator.comparingLong(NameSuggestion::documentCount).reversed())
                .thenComparingInt(suggestion -> suggestion.name().length())
                .thenComparing(NameSuggestion::name))
            .limit(max)
            .toList();

        log.debug("Suggested {} names for '{}'", suggestions.size(), normalized);
        return new SuggestionResult(partialTerm, normalized, suggestions);
    }

    private List<DocumentRecord> fetchCandidates(String normalized, String ownerUserId) {
        List<String> hints = nameNormalizer.tokens(normalized).stream()
            .filter(token -> token.length() >= properties.minHintTokenLength())
            .distinct()
            .toList();

        Map<UUID, DocumentRecord> candidates = new LinkedHashMap<>();
        if (!hints.isEmpty()) {
            DocumentFilter hinted = DocumentFilter.namedDocuments(ownerUserId).toBuilder()
                .nameTokens(hints)
                .build();
            collect(candidates, hinted, properties.candidateLimit());
        }

        if (candidates.size() < properties.fallbackThreshold() && properties.fallbackLimit() > 0) {
            collect(candidates, DocumentFilter.namedDocuments(ownerUserId), properties.fallbackLimit());
        }
        return new ArrayList<>(candidates.values());
    }

    private void collect(Map<UUID, DocumentRecord> candidates, DocumentFilter filter, int limit) {
        documentRepository.findMany(filter, limit, 0).items()
            .forEach(document -> candidates.putIfAbsent(document.id(), document));
    }

    private List<ScoredDocument> rank(String normalized, List<DocumentRecord> candidates,
                                      double minSimilarity, Set<MatchType> strategies) {
        List<ScoredDocument> ranked = new ArrayList<>();
        for (DocumentRecord candidate : candidates) {
            if (!candidate.medicalInfoValid()) {
                continue;
            }
            similarityScorer.score(normalized, candidate.normalizedPatientName(), strategies)
                .filter(match -> match.score() >= minSimilarity)
                .map((SimilarityMatch match) -> ScoredDocument.of(candidate, match))
                .ifPresent(ranked::add);
        }
        ranked.sort(ScoredDocument.RANKING);
        return ranked;
    }

    private PatientSearchResult page(String term, String normalized, List<ScoredDocument> ranked,
                                     int limit, int skip, double minSimilarity) {
        int total = ranked.size();
        List<ScoredDocument> items = skip >= total
            ? List.of()
            : ranked.subList(skip, skip + Math.min(total - skip, limit));

        Set<MatchType> present = ranked.stream()
            .map(ScoredDocument::matchType)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(MatchType.class)));

        return new PatientSearchResult(
            term,
            normalized,
            total,
            items,
            limit,
            skip,
            skip < total - limit,
            skip > 0,
            (total + limit - 1) / limit,
            List.copyOf(present),
            minSimilarity,
            OffsetDateTime.now(clock)
        );
    }

    private void validateTerm(String term) {
        if (term == null || term.isBlank()) {
            throw new ValidationException("Search term cannot be blank");
        }
        if (term.length() > properties.maxTermLength()) {
            throw new ValidationException("Search term is longer than " + properties.maxTermLength() + " characters");
        }
    }

    private String normalizeTerm(String term) {
        String normalized = nameNormalizer.normalize(term);
        if (normalized.isEmpty()) {
            throw new ValidationException("Search term has no searchable characters", "Use letters or digits of the patient name");
        }
        return normalized;
    }

    private int validateLimit(Integer limit) {
        int value = limit == null ? properties.defaultLimit() : limit;
        if (value < 1 || value > properties.maxLimit()) {
            throw new ValidationException("limit must be between 1 and " + properties.maxLimit());
        }
        return value;
    }

    private int validateSkip(Integer skip) {
        int value = skip == null ? 0 : skip;
        if (value < 0) {
            throw new ValidationException("skip cannot be negative");
        }
        return value;
    }

    private double validateMinSimilarity(Double minSimilarity) {
        double value = minSimilarity == null ? properties.defaultMinSimilarity() : minSimilarity;
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException("min_similarity must be between 0 and 1");
        }
        return value;
    }
}
