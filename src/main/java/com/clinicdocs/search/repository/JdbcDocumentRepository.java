package com.clinicdocs.search.repository;

import com.clinicdocs.search.model.DocumentFilter;
import com.clinicdocs.search.model.DocumentPage;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.DocumentStatistics;
import com.clinicdocs.search.model.InsertOutcome;
import com.clinicdocs.search.model.OcrSummary;
import com.clinicdocs.search.model.ProcessingStatus;
import com.clinicdocs.search.model.StorageLocation;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private static final String INSERT_COLUMNS = """
        id, processing_id, batch_id, batch_index, filename, content_type, file_size, owner_user_id,
        description, tags, blob_name, blob_url, container_name, extracted_text, page_count,
        processing_time_seconds, text_extracted, expediente, nombre_paciente, normalized_patient_name,
        numero_episodio, categoria, medical_info_valid, medical_info_error, processing_status,
        error_message, created_at, updated_at
        """;

    private final JdbcClient jdbcClient;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<DocumentRecord> documentRowMapper = (rs, rowNum) -> {
        String blobName = rs.getString("blob_name");
        StorageLocation storage = blobName == null
            ? null
            : new StorageLocation(blobName, rs.getString("blob_url"), rs.getString("container_name"));

        Array tags = rs.getArray("tags");

        return DocumentRecord.builder()
            .id(rs.getObject("id", UUID.class))
            .processingId(rs.getObject("processing_id", UUID.class))
            .batchId(rs.getObject("batch_id", UUID.class))
            .batchIndex(rs.getObject("batch_index", Integer.class))
            .filename(rs.getString("filename"))
            .contentType(rs.getString("content_type"))
            .fileSize(rs.getLong("file_size"))
            .ownerUserId(rs.getString("owner_user_id"))
            .description(rs.getString("description"))
            .tags(tags == null ? List.of() : Arrays.asList((String[]) tags.getArray()))
            .storage(storage)
            .extractedText(rs.getString("extracted_text"))
            .ocrSummary(new OcrSummary(
                rs.getInt("page_count"),
                rs.getDouble("processing_time_seconds"),
                rs.getBoolean("text_extracted")))
            .expediente(rs.getString("expediente"))
            .nombrePaciente(rs.getString("nombre_paciente"))
            .normalizedPatientName(rs.getString("normalized_patient_name"))
            .numeroEpisodio(rs.getString("numero_episodio"))
            .categoria(rs.getString("categoria"))
            .medicalInfoValid(rs.getBoolean("medical_info_valid"))
            .medicalInfoError(rs.getString("medical_info_error"))
            .processingStatus(ProcessingStatus.valueOf(rs.getString("processing_status")))
            .errorMessage(rs.getString("error_message"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .build();
    };

    @Override
    public DocumentRecord insertOne(DocumentRecord record) {
        StorageLocation storage = record.storage();
        return jdbcClient.sql("""
                INSERT INTO documents (%s)
                VALUES (:id, :processingId, :batchId, :batchIndex, :filename, :contentType, :fileSize, :ownerUserId,
                        :description, :tags, :blobName, :blobUrl, :containerName, :extractedText, :pageCount,
                        :processingTime, :textExtracted, :expediente, :nombrePaciente, :normalizedPatientName,
                        :numeroEpisodio, :categoria, :medicalInfoValid, :medicalInfoError,
                        :processingStatus::processing_status, :errorMessage, :createdAt, :updatedAt)
                RETURNING *
                """.formatted(INSERT_COLUMNS))
            .param("id", record.id())
            .param("processingId", record.processingId())
            .param("batchId", record.batchId(), Types.OTHER)
            .param("batchIndex", record.batchIndex(), Types.INTEGER)
            .param("filename", record.filename())
            .param("contentType", record.contentType())
            .param("fileSize", record.fileSize())
            .param("ownerUserId", record.ownerUserId(), Types.VARCHAR)
            .param("description", record.description(), Types.VARCHAR)
            .param("tags", record.tags().toArray(new String[0]))
            .param("blobName", storage == null ? null : storage.blobName(), Types.VARCHAR)
            .param("blobUrl", storage == null ? null : storage.blobUrl(), Types.VARCHAR)
            .param("containerName", storage == null ? null : storage.containerName(), Types.VARCHAR)
            .param("extractedText", record.extractedText(), Types.VARCHAR)
            .param("pageCount", record.ocrSummary().pageCount())
            .param("processingTime", record.ocrSummary().processingTimeSeconds())
            .param("textExtracted", record.ocrSummary().textExtracted())
            .param("expediente", record.expediente(), Types.VARCHAR)
            .param("nombrePaciente", record.nombrePaciente(), Types.VARCHAR)
            .param("normalizedPatientName", record.normalizedPatientName(), Types.VARCHAR)
            .param("numeroEpisodio", record.numeroEpisodio(), Types.VARCHAR)
            .param("categoria", record.categoria(), Types.VARCHAR)
            .param("medicalInfoValid", record.medicalInfoValid())
            .param("medicalInfoError", record.medicalInfoError(), Types.VARCHAR)
            .param("processingStatus", record.processingStatus().name())
            .param("errorMessage", record.errorMessage(), Types.VARCHAR)
            .param("createdAt", record.createdAt())
            .param("updatedAt", record.updatedAt())
            .query(documentRowMapper)
            .single();
    }

    @Override
    @Transactional
    public List<InsertOutcome> insertMany(List<DocumentRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        String sql = """
            INSERT INTO documents (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::processing_status, ?, ?, ?)
            """.formatted(INSERT_COLUMNS);

        int[] counts = jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                DocumentRecord record = records.get(i);
                StorageLocation storage = record.storage();
                ps.setObject(1, record.id());
                ps.setObject(2, record.processingId());
                ps.setObject(3, record.batchId(), Types.OTHER);
                ps.setObject(4, record.batchIndex(), Types.INTEGER);
                ps.setString(5, record.filename());
                ps.setString(6, record.contentType());
                ps.setLong(7, record.fileSize());
                ps.setString(8, record.ownerUserId());
                ps.setString(9, record.description());
                ps.setArray(10, ps.getConnection().createArrayOf("text", record.tags().toArray()));
                ps.setString(11, storage == null ? null : storage.blobName());
                ps.setString(12, storage == null ? null : storage.blobUrl());
                ps.setString(13, storage == null ? null : storage.containerName());
                ps.setString(14, record.extractedText());
                ps.setInt(15, record.ocrSummary().pageCount());
                ps.setDouble(16, record.ocrSummary().processingTimeSeconds());
                ps.setBoolean(17, record.ocrSummary().textExtracted());
                ps.setString(18, record.expediente());
                ps.setString(19, record.nombrePaciente());
                ps.setString(20, record.normalizedPatientName());
                ps.setString(21, record.numeroEpisodio());
                ps.setString(22, record.categoria());
                ps.setBoolean(23, record.medicalInfoValid());
                ps.setString(24, record.medicalInfoError());
                ps.setString(25, record.processingStatus().name());
                ps.setString(26, record.errorMessage());
                ps.setObject(27, record.createdAt());
                ps.setObject(28, record.updatedAt());
            }

            @Override
            public int getBatchSize() {
                return records.size();
            }
        });

        log.debug("Bulk inserted {} documents", records.size());
        return IntStream.range(0, records.size())
            .mapToObj(i -> new InsertOutcome(
                records.get(i).id(),
                counts[i] > 0 || counts[i] == Statement.SUCCESS_NO_INFO))
            .toList();
    }

    @Override
    public Optional<DocumentRecord> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public DocumentPage findMany(DocumentFilter filter, int limit, int skip) {
        Where where = where(filter);

        long total = jdbcClient.sql("SELECT COUNT(*) FROM documents" + where.sql())
            .params(where.params())
            .query(Long.class)
            .single();
        if (total == 0) {
            return DocumentPage.empty();
        }

        Map<String, Object> params = new HashMap<>(where.params());
        params.put("limit", limit);
        params.put("skip", skip);

        List<DocumentRecord> items = jdbcClient.sql("""
                SELECT * FROM documents%s
                ORDER BY created_at DESC, id ASC
                LIMIT :limit OFFSET :skip
                """.formatted(where.sql()))
            .params(params)
            .query(documentRowMapper)
            .list();

        return new DocumentPage(items, total);
    }

    @Override
    public boolean delete(UUID id) {
        return jdbcClient.sql("DELETE FROM documents WHERE id = :id")
            .param("id", id)
            .update() > 0;
    }

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public DocumentStatistics statistics(Optional<String> ownerUserId) {
        Where where = where(DocumentFilter.builder().ownerUserId(ownerUserId.orElse(null)).build());

        Totals totals = jdbcClient.sql("""
                SELECT COUNT(*) AS total,
                       COUNT(*) FILTER (WHERE medical_info_valid) AS valid,
                       COUNT(DISTINCT normalized_patient_name) AS patients,
                       COALESCE(SUM(file_size), 0) AS total_size,
                       COALESCE(AVG(file_size), 0) AS avg_size
                FROM documents%s
                """.formatted(where.sql()))
            .params(where.params())
            .query((rs, rowNum) -> new Totals(
                rs.getLong("total"),
                rs.getLong("valid"),
                rs.getLong("patients"),
                rs.getLong("total_size"),
                rs.getDouble("avg_size")
            ))
            .single();

        Map<ProcessingStatus, Long> byStatus = new EnumMap<>(ProcessingStatus.class);
        jdbcClient.sql("""
                SELECT processing_status::text AS status, COUNT(*) AS count
                FROM documents%s
                GROUP BY processing_status
                """.formatted(where.sql()))
            .params(where.params())
            .query((rs, rowNum) -> Map.entry(ProcessingStatus.valueOf(rs.getString("status")), rs.getLong("count")))
            .list()
            .forEach(entry -> byStatus.put(entry.getKey(), entry.getValue()));

        Map<String, Long> byCategoria = new LinkedHashMap<>();
        jdbcClient.sql("""
                SELECT categoria, COUNT(*) AS count
                FROM documents%s
                GROUP BY categoria
                ORDER BY categoria
                """.formatted(where.and("categoria IS NOT NULL").sql()))
            .params(where.params())
            .query((rs, rowNum) -> Map.entry(rs.getString("categoria"), rs.getLong("count")))
            .list()
            .forEach(entry -> byCategoria.put(entry.getKey(), entry.getValue()));

        return new DocumentStatistics(
            totals.total(),
            byStatus,
            byCategoria,
            totals.valid(),
            totals.total() - totals.valid(),
            totals.patients(),
            totals.totalSize(),
            totals.averageSize()
        );
    }

    private record Totals(long total, long valid, long patients, long totalSize, double averageSize) {}

    private record Where(List<String> clauses, Map<String, Object> params) {

        String sql() {
            return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        }

        Where and(String clause) {
            List<String> extended = new ArrayList<>(clauses);
            extended.add(clause);
            return new Where(extended, params);
        }
    }

    private static Where where(DocumentFilter filter) {
        List<String> clauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (filter.ownerUserId() != null) {
            clauses.add("owner_user_id = :ownerUserId");
            params.put("ownerUserId", filter.ownerUserId());
        }
        if (filter.batchId() != null) {
            clauses.add("batch_id = :batchId");
            params.put("batchId", filter.batchId());
        }
        if (filter.status() != null) {
            clauses.add("processing_status = :status::processing_status");
            params.put("status", filter.status().name());
        }
        if (Boolean.TRUE.equals(filter.hasPatientName())) {
            clauses.add("normalized_patient_name IS NOT NULL");
        } else if (Boolean.FALSE.equals(filter.hasPatientName())) {
            clauses.add("normalized_patient_name IS NULL");
        }
        if (filter.namePrefix() != null) {
            clauses.add("normalized_patient_name LIKE :namePrefix");
            params.put("namePrefix", escapeLike(filter.namePrefix()) + "%");
        }
        if (filter.nameContains() != null) {
            clauses.add("normalized_patient_name LIKE :nameContains");
            params.put("nameContains", "%" + escapeLike(filter.nameContains()) + "%");
        }
        if (filter.namePrefixOf() != null) {
            clauses.add("starts_with(:namePrefixOf, normalized_patient_name)");
            params.put("namePrefixOf", filter.namePrefixOf());
        }
        if (!filter.nameTokens().isEmpty()) {
            clauses.add("normalized_patient_name LIKE ANY (:nameTokens)");
            params.put("nameTokens", filter.nameTokens().stream()
                .map(token -> "%" + escapeLike(token) + "%")
                .toArray(String[]::new));
        }
        return new Where(clauses, params);
    }

    // backslash is the default LIKE escape character in Postgres
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
