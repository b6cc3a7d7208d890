package com.clinicdocs.search;

import com.clinicdocs.search.repository.BaseIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "app.ingestion.allowed-extensions=pdf,txt",
        "app.storage.local.root-dir=target/e2e-blobs"
    }
)
class PatientDocumentSearchE2ETest extends BaseIntegrationTest {

    private static final String OWNER = "clinic-7";

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private JdbcClient jdbcClient;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM documents").update();
    }

    private static ByteArrayResource textFile(String filename, String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return filename;
            }
        };
    }

    private ResponseEntity<JsonNode> uploadBatch(List<ByteArrayResource> files) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        files.forEach(file -> body.add("files", file));
        body.add("user_id", OWNER);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return restTemplate.postForEntity("/documents/batch", new HttpEntity<>(body, headers), JsonNode.class);
    }

    @Test
    @DisplayName("E2E: batch upload, fuzzy search, suggestions, owner isolation and delete")
    void ingestSearchAndDelete() {
        ResponseEntity<JsonNode> batch = uploadBatch(List.of(
            textFile("1234567890_GARCIA LOPEZ, MARIA_0000000001_EMER.txt", "Paciente ingresa por dolor toracico"),
            textFile("1234567891_PEREZ, JUAN_0000000002_LAB.txt", "Hemograma dentro de rangos normales"),
            textFile("notas_sueltas.txt", "Notas sin paciente")
        ));

        assertThat(batch.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode summary = batch.getBody();
        assertThat(summary.get("total_files").asInt()).isEqualTo(3);
        assertThat(summary.get("processed_count").asInt()).isEqualTo(3);
        assertThat(summary.get("processing_status").asText()).isEqualTo("completed");
        assertThat(summary.get("documents")).hasSize(3);

        List<String> validity = new ArrayList<>();
        summary.get("documents").forEach(doc -> validity.add(doc.get("medical_info").get("valid").asText()));
        assertThat(validity).containsExactly("true", "true", "false");

        String mariaId = summary.get("documents").get(0).get("id").asText();
        assertThat(summary.get("documents").get(0).get("extracted_text").asText()).contains("dolor toracico");

        // typo in the last name still finds the patient
        JsonNode search = restTemplate.getForObject("/search/patients?q={q}&user_id={u}", JsonNode.class, "garcia lopes", OWNER);
        assertThat(search.get("total_found").asInt()).isEqualTo(1);
        assertThat(search.get("results").get(0).get("document_id").asText()).isEqualTo(mariaId);
        assertThat(search.get("results").get(0).get("match_type").asText()).isEqualTo("fuzzy");

        JsonNode other = restTemplate.getForObject("/search/patients?q={q}&user_id={u}", JsonNode.class, "garcia", "another-clinic");
        assertThat(other.get("total_found").asInt()).isZero();

        JsonNode suggestions = restTemplate.getForObject("/search/patients/suggestions?q={q}&user_id={u}", JsonNode.class, "per", OWNER);
        assertThat(suggestions.get("suggestions").get(0).asText()).isEqualTo("PEREZ, JUAN");

        JsonNode patientDocs = restTemplate.getForObject("/search/patients/documents?name={n}&user_id={u}", JsonNode.class,
            "García López, María", OWNER);
        assertThat(patientDocs.get("results")).hasSize(1);
        assertThat(patientDocs.get("results").get(0).get("match_type").asText()).isEqualTo("exact");

        ResponseEntity<JsonNode> foreign = restTemplate.getForEntity("/documents/{id}?user_id={u}", JsonNode.class, mariaId, "another-clinic");
        assertThat(foreign.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);

        JsonNode stats = restTemplate.getForObject("/documents/statistics?user_id={u}", JsonNode.class, OWNER);
        assertThat(stats.get("total_documents").asInt()).isEqualTo(3);
        assertThat(stats.get("invalid_medical_info").asInt()).isEqualTo(1);

        ResponseEntity<Void> deleted = restTemplate.exchange("/documents/{id}?user_id={u}", HttpMethod.DELETE, null, Void.class, mariaId, OWNER);
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);

        ResponseEntity<JsonNode> gone = restTemplate.getForEntity("/documents/{id}", JsonNode.class, mariaId);
        assertThat(gone.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(gone.getBody().get("errorCode").asText()).isEqualTo("RESOURCE_NOT_FOUND");
    }

    @Test
    @DisplayName("E2E: a batch over the size limit is rejected as a whole")
    void rejectsOversizedBatch() {
        List<ByteArrayResource> files = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            files.add(textFile(i + "_GARCIA, ANA_1_EMER.txt", "texto"));
        }

        ResponseEntity<JsonNode> response = uploadBatch(files);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("errorCode").asText()).isEqualTo("VALIDATION_ERROR");
        assertThat(jdbcClient.sql("SELECT COUNT(*) FROM documents").query(Long.class).single()).isZero();
    }
}
