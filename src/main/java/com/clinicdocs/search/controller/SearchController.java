package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.PatientSearchQuery;
import com.clinicdocs.search.service.PatientSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/search/patients")
@RequiredArgsConstructor
public class SearchController {

    private final PatientSearchService patientSearchService;

    @GetMapping
    public ResponseEntity<PatientSearchResponse> searchPatients(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "min_similarity", required = false) Double minSimilarity,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "skip", required = false) Integer skip) {

        var result = patientSearchService.searchPatients(new PatientSearchQuery(query, userId, minSimilarity, limit, skip));
        return ResponseEntity.ok(PatientSearchResponse.from(result));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<SuggestionResponse> suggestions(
        @RequestParam(name = "q") String partialTerm,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "limit", required = false) Integer limit) {

        return ResponseEntity.ok(SuggestionResponse.from(patientSearchService.suggestPatientNames(partialTerm, userId, limit)));
    }

    @GetMapping("/documents")
    public ResponseEntity<PatientSearchResponse> documentsForPatient(
        @RequestParam(name = "name") String patientName,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "skip", required = false) Integer skip) {

        var result = patientSearchService.documentsForPatient(patientName, userId, limit, skip);
        return ResponseEntity.ok(PatientSearchResponse.from(result));
    }
}
