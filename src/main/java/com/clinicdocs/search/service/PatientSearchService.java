package com.clinicdocs.search.service;

import com.clinicdocs.search.model.PatientSearchQuery;
import com.clinicdocs.search.model.PatientSearchResult;
import com.clinicdocs.search.model.SuggestionResult;

public interface PatientSearchService {

    PatientSearchResult searchPatients(PatientSearchQuery query);

    SuggestionResult suggestPatientNames(String partialTerm, String ownerUserId, Integer limit);

    /**
     * Documents whose patient name equals or starts with {@code patientName}.
     */
    PatientSearchResult documentsForPatient(String patientName, String ownerUserId, Integer limit, Integer skip);
}
