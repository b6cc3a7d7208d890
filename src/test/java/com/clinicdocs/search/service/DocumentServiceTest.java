package com.clinicdocs.search.service;

import com.clinicdocs.search.exception.DocumentAccessDeniedException;
import com.clinicdocs.search.exception.DocumentNotFoundException;
import com.clinicdocs.search.exception.StorageGatewayException;
import com.clinicdocs.search.exception.ValidationException;
import com.clinicdocs.search.gateway.StorageGateway;
import com.clinicdocs.search.model.DocumentFilter;
import com.clinicdocs.search.model.DocumentPage;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.DocumentStatistics;
import com.clinicdocs.search.model.ProcessingStatus;
import com.clinicdocs.search.repository.DocumentRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.clinicdocs.search.TestDocuments.patientDocument;
import static com.clinicdocs.search.TestDocuments.unnamedDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DocumentServiceTest {

    private final DocumentRepository repository = Mockito.mock(DocumentRepository.class);
    private final StorageGateway storageGateway = Mockito.mock(StorageGateway.class);
    private final DocumentService documentService = new DocumentServiceImpl(repository, storageGateway);

    @Nested
    @DisplayName("Get document")
    class GetDocument {

        @Test
        @DisplayName("Should return the document to its owner")
        void shouldReturnOwnedDocument() {
            DocumentRecord document = patientDocument("GARCIA, MARIA", "owner-1");
            when(repository.findById(document.id())).thenReturn(Optional.of(document));

            assertThat(documentService.getDocument(document.id(), "owner-1")).isEqualTo(document);
            assertThat(documentService.getDocument(document.id(), null)).isEqualTo(document);
        }

        @Test
        @DisplayName("Should throw DocumentNotFoundException for unknown ids")
        void shouldThrowWhenMissing() {
            UUID id = UUID.randomUUID();
            when(repository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> documentService.getDocument(id, null))
                .isInstanceOf(DocumentNotFoundException.class)
                .hasMessage("Document not found: " + id);
        }

        @Test
        @DisplayName("Should deny access to another user's document")
        void shouldDenyForeignDocument() {
            DocumentRecord document = patientDocument("GARCIA, MARIA", "owner-1");
            when(repository.findById(document.id())).thenReturn(Optional.of(document));

            assertThatThrownBy(() -> documentService.getDocument(document.id(), "owner-2"))
                .isInstanceOf(DocumentAccessDeniedException.class);
        }

        @Test
        @DisplayName("Documents without owner are visible to everyone")
        void shouldShareUnownedDocument() {
            DocumentRecord document = patientDocument("GARCIA, MARIA", null);
            when(repository.findById(document.id())).thenReturn(Optional.of(document));

            assertThat(documentService.getDocument(document.id(), "owner-2")).isEqualTo(document);
        }
    }

    @Nested
    @DisplayName("Delete document")
    class DeleteDocument {

        @Test
        @DisplayName("Should delete the record and then its blob")
        void shouldDeleteRecordAndBlob() {
            DocumentRecord document = patientDocument("GARCIA, MARIA", "owner-1");
            when(repository.findById(document.id())).thenReturn(Optional.of(document));
            when(repository.delete(document.id())).thenReturn(true);

            documentService.deleteDocument(document.id(), "owner-1");

            verify(repository).delete(document.id());
            verify(storageGateway).delete(document.storage().blobName());
        }

        @Test
        @DisplayName("Should succeed even when the blob cannot be removed")
        void shouldTolerateBlobFailure() {
            DocumentRecord document = patientDocument("GARCIA, MARIA", "owner-1");
            when(repository.findById(document.id())).thenReturn(Optional.of(document));
            when(repository.delete(document.id())).thenReturn(true);
            when(storageGateway.delete(anyString())).thenThrow(new StorageGatewayException("timeout"));

            assertThatCode(() -> documentService.deleteDocument(document.id(), "owner-1")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should not touch storage for a record that was never stored")
        void shouldSkipBlobForUnstoredRecord() {
            DocumentRecord document = unnamedDocument("scan.pdf");
            when(repository.findById(document.id())).thenReturn(Optional.of(document));
            when(repository.delete(document.id())).thenReturn(true);

            documentService.deleteDocument(document.id(), null);

            verify(storageGateway, never()).delete(anyString());
        }

        @Test
        @DisplayName("Should not delete another user's document")
        void shouldDenyForeignDelete() {
            DocumentRecord document = patientDocument("GARCIA, MARIA", "owner-1");
            when(repository.findById(document.id())).thenReturn(Optional.of(document));

            assertThatThrownBy(() -> documentService.deleteDocument(document.id(), "owner-2"))
                .isInstanceOf(DocumentAccessDeniedException.class);
            verify(repository, never()).delete(any());
        }

        @Test
        @DisplayName("Should report a record removed concurrently as not found")
        void shouldReportConcurrentDelete() {
            DocumentRecord document = patientDocument("GARCIA, MARIA", "owner-1");
            when(repository.findById(document.id())).thenReturn(Optional.of(document));
            when(repository.delete(document.id())).thenReturn(false);

            assertThatThrownBy(() -> documentService.deleteDocument(document.id(), "owner-1"))
                .isInstanceOf(DocumentNotFoundException.class);
            verify(storageGateway, never()).delete(anyString());
        }
    }

    @Test
    @DisplayName("Should validate list paging")
    void shouldValidateListPaging() {
        when(repository.findMany(any(), anyInt(), anyInt())).thenReturn(DocumentPage.empty());

        assertThat(documentService.listDocuments(null, 20, 0).totalFound()).isZero();
        assertThatThrownBy(() -> documentService.listDocuments(DocumentFilter.none(), 0, 0))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> documentService.listDocuments(DocumentFilter.none(), 101, 0))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> documentService.listDocuments(DocumentFilter.none(), 10, -1))
            .isInstanceOf(ValidationException.class);
        verify(repository).findMany(DocumentFilter.none(), 20, 0);
    }

    @Test
    @DisplayName("Should scope statistics to the owner")
    void shouldScopeStatistics() {
        DocumentStatistics stats = new DocumentStatistics(2, Map.of(ProcessingStatus.COMPLETED, 2L), Map.of("EMER", 2L),
            2, 0, 1, 2048, 1024.0);
        when(repository.statistics(Optional.of("owner-1"))).thenReturn(stats);

        assertThat(documentService.statistics("owner-1")).isEqualTo(stats);
    }
}
