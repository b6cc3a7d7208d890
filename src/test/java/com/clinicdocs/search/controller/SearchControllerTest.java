package com.clinicdocs.search.controller;

import com.clinicdocs.search.exception.ValidationException;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.MatchType;
import com.clinicdocs.search.model.NameSuggestion;
import com.clinicdocs.search.model.PatientSearchQuery;
import com.clinicdocs.search.model.PatientSearchResult;
import com.clinicdocs.search.model.ScoredDocument;
import com.clinicdocs.search.model.SuggestionResult;
import com.clinicdocs.search.service.PatientSearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;

import static com.clinicdocs.search.TestDocuments.patientDocument;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PatientSearchService patientSearchService;

    private static PatientSearchResult resultFor(String term, DocumentRecord document, double score, MatchType type) {
        return new PatientSearchResult(
            term,
            term.toUpperCase(),
            1,
            List.of(new ScoredDocument(document, score, type)),
            20,
            0,
            false,
            false,
            1,
            List.of(type),
            0.3,
            OffsetDateTime.now()
        );
    }

    @Test
    @DisplayName("GET /search/patients should return ranked matches")
    void searchPatients_ShouldReturnMatches() throws Exception {
        DocumentRecord document = patientDocument("GARCIA LOPEZ, MARIA");
        PatientSearchQuery query = new PatientSearchQuery("garcia", "owner-1", 0.5, 10, 0);
        when(patientSearchService.searchPatients(query)).thenReturn(resultFor("garcia", document, 0.86315, MatchType.PREFIX));

        mockMvc.perform(get("/search/patients")
                .param("q", "garcia")
                .param("user_id", "owner-1")
                .param("min_similarity", "0.5")
                .param("limit", "10")
                .param("skip", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.search_term").value("garcia"))
            .andExpect(jsonPath("$.total_found").value(1))
            .andExpect(jsonPath("$.results[0].document_id").value(document.id().toString()))
            .andExpect(jsonPath("$.results[0].similarity_score").value(0.863))
            .andExpect(jsonPath("$.results[0].match_type").value("prefix"))
            .andExpect(jsonPath("$.strategies_used[0]").value("prefix"));
    }

    @Test
    @DisplayName("GET /search/patients should pass absent paging parameters as null")
    void searchPatients_ShouldUseServiceDefaults() throws Exception {
        DocumentRecord document = patientDocument("GARCIA LOPEZ, MARIA");
        when(patientSearchService.searchPatients(any())).thenReturn(resultFor("garcia", document, 0.9, MatchType.PREFIX));

        mockMvc.perform(get("/search/patients").param("q", "garcia"))
            .andExpect(status().isOk());

        verify(patientSearchService).searchPatients(new PatientSearchQuery("garcia", null, null, null, null));
    }

    @Test
    @DisplayName("GET /search/patients without q should return 400")
    void searchPatients_ShouldReturn400_WhenQueryMissing() throws Exception {
        mockMvc.perform(get("/search/patients"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"))
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(patientSearchService);
    }

    @Test
    @DisplayName("GET /search/patients should return 400 for invalid search parameters")
    void searchPatients_ShouldReturn400_WhenRejected() throws Exception {
        when(patientSearchService.searchPatients(any()))
            .thenThrow(new ValidationException("limit must be between 1 and 100"));

        mockMvc.perform(get("/search/patients").param("q", "garcia").param("limit", "500"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("limit must be between 1 and 100"));
    }

    @Test
    @DisplayName("GET /search/patients/suggestions should return names with details")
    void suggestions_ShouldReturnNames() throws Exception {
        when(patientSearchService.suggestPatientNames("garc", "owner-1", 5)).thenReturn(new SuggestionResult(
            "garc",
            "GARC",
            List.of(new NameSuggestion("GARCIA, PEDRO", 0.86, MatchType.PREFIX, 3))
        ));

        mockMvc.perform(get("/search/patients/suggestions")
                .param("q", "garc")
                .param("user_id", "owner-1")
                .param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.suggestions[0]").value("GARCIA, PEDRO"))
            .andExpect(jsonPath("$.details[0].document_count").value(3))
            .andExpect(jsonPath("$.details[0].match_type").value("prefix"));
    }

    @Test
    @DisplayName("GET /search/patients/documents should return the patient's documents")
    void documentsForPatient_ShouldReturnMatches() throws Exception {
        DocumentRecord document = patientDocument("GARCIA LOPEZ, MARIA");
        when(patientSearchService.documentsForPatient(eq("garcia lopez, maria"), eq("owner-1"), any(), any()))
            .thenReturn(resultFor("garcia lopez, maria", document, 1.0, MatchType.EXACT));

        mockMvc.perform(get("/search/patients/documents")
                .param("name", "garcia lopez, maria")
                .param("user_id", "owner-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results[0].match_type").value("exact"))
            .andExpect(jsonPath("$.results[0].nombre_paciente").value("GARCIA LOPEZ, MARIA"));
    }
}
