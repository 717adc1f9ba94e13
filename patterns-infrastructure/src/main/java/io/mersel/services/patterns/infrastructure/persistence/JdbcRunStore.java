package io.mersel.services.patterns.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mersel.services.patterns.application.enums.RunKind;
import io.mersel.services.patterns.application.enums.RunStatus;
import io.mersel.services.patterns.application.enums.Verdict;
import io.mersel.services.patterns.application.enums.VersionSource;
import io.mersel.services.patterns.application.interfaces.IRunStore;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.MatchExplanation;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.PatternMatch;
import io.mersel.services.patterns.application.models.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Çalıştırma, fact, ilişki ve eşleşme kayıtları.
 * <p>
 * Eklemeler en-az-bir-kez semantiğindedir: aynı kimlikle tekrar yazılan satır yok sayılır.
 */
@Repository
public class JdbcRunStore implements IRunStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Long>> STATISTICS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json = new JsonColumns();

    public JdbcRunStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    // ── Çalıştırmalar ───────────────────────────────────────────────

    private final RowMapper<RunRecord> runMapper = (rs, rowNum) -> new RunRecord(
            rs.getString("id"),
            rs.getString("workspace_id"),
            RunKind.valueOf(rs.getString("kind")),
            RunStatus.valueOf(rs.getString("status")),
            rs.getString("document_name"),
            rs.getString("schema_version"),
            rs.getString("message_root"),
            rs.getString("owner_code"),
            rs.getString("version_source") == null ? null : VersionSource.valueOf(rs.getString("version_source")),
            json.read(rs.getString("warnings_json"), STRING_LIST, List.of()),
            json.read(rs.getString("statistics_json"), STATISTICS, Map.of()),
            rs.getString("error_message"),
            JsonColumns.instant(rs.getTimestamp("started_at")),
            JsonColumns.instant(rs.getTimestamp("finished_at")));

    @Override
    public void saveRun(RunRecord run) {
        try {
            jdbcTemplate.update("""
                            INSERT INTO runs (workspace_id, id, kind, status, document_name, schema_version,
                                message_root, owner_code, version_source, warnings_json, statistics_json,
                                error_message, started_at, finished_at)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                            """,
                    run.workspaceId(), run.id(), run.kind().name(), run.status().name(), run.documentName(),
                    run.version(), run.messageRoot(), run.ownerCode(),
                    run.versionSource() == null ? null : run.versionSource().name(),
                    json.write(run.warnings()), json.write(run.statistics()), run.errorMessage(),
                    JsonColumns.timestamp(run.startedAt()), JsonColumns.timestamp(run.finishedAt()));
        } catch (DuplicateKeyException e) {
            log.debug("Çalıştırma zaten kayıtlı, yok sayıldı: {}", run.id());
        }
    }

    @Override
    public void updateRun(RunRecord run) {
        jdbcTemplate.update("""
                        UPDATE runs
                           SET status = ?, schema_version = ?, message_root = ?, owner_code = ?, version_source = ?,
                               warnings_json = ?, statistics_json = ?, error_message = ?, finished_at = ?
                         WHERE workspace_id = ? AND id = ?
                        """,
                run.status().name(), run.version(), run.messageRoot(), run.ownerCode(),
                run.versionSource() == null ? null : run.versionSource().name(),
                json.write(run.warnings()), json.write(run.statistics()), run.errorMessage(),
                JsonColumns.timestamp(run.finishedAt()), run.workspaceId(), run.id());
    }

    @Override
    public Optional<RunRecord> findRun(String workspaceId, String runId) {
        return jdbcTemplate.query("SELECT * FROM runs WHERE workspace_id = ? AND id = ?",
                runMapper, workspaceId, runId).stream().findFirst();
    }

    // ── Fact'ler ────────────────────────────────────────────────────

    private final RowMapper<NodeFact> factMapper = (rs, rowNum) -> new NodeFact(
            rs.getString("id"),
            rs.getString("workspace_id"),
            rs.getString("run_id"),
            rs.getString("schema_version"),
            rs.getString("message_root"),
            rs.getString("section_path"),
            rs.getString("node_type"),
            rs.getInt("node_ordinal"),
            json.read(rs.getString("payload_json"), FactPayload.class),
            rs.getString("snippet"),
            rs.getBoolean("masked"),
            rs.getBoolean("extraction_failed"));

    @Override
    public void saveFacts(List<NodeFact> facts) {
        for (NodeFact fact : facts) {
            insertIgnoringDuplicate(fact.id(), """
                            INSERT INTO node_facts (workspace_id, id, run_id, schema_version, message_root,
                                section_path, node_type, node_ordinal, payload_json, snippet, masked, extraction_failed)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                            """,
                    fact.workspaceId(), fact.id(), fact.runId(), fact.version(), fact.messageRoot(),
                    fact.sectionPath(), fact.nodeType(), fact.ordinal(), json.write(fact.payload()),
                    fact.snippet(), fact.masked(), fact.extractionFailed());
        }
    }

    @Override
    public List<NodeFact> findFacts(String workspaceId, String runId) {
        return jdbcTemplate.query("""
                        SELECT * FROM node_facts WHERE workspace_id = ? AND run_id = ?
                         ORDER BY section_path, node_ordinal
                        """,
                factMapper, workspaceId, runId);
    }

    // ── İlişkiler ───────────────────────────────────────────────────

    private final RowMapper<NodeRelationship> relationshipMapper = (rs, rowNum) -> new NodeRelationship(
            rs.getString("id"),
            rs.getString("workspace_id"),
            rs.getString("run_id"),
            rs.getString("source_fact_id"),
            rs.getString("source_section"),
            rs.getString("target_section"),
            rs.getString("reference_type"),
            rs.getString("field_name"),
            rs.getString("raw_value"),
            rs.getBoolean("is_valid"),
            rs.getBoolean("is_expected"),
            rs.getDouble("confidence"));

    @Override
    public void saveRelationships(List<NodeRelationship> relationships) {
        for (NodeRelationship rel : relationships) {
            insertIgnoringDuplicate(rel.id(), """
                            INSERT INTO node_relationships (workspace_id, id, run_id, source_fact_id, source_section,
                                target_section, reference_type, field_name, raw_value, is_valid, is_expected, confidence)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                            """,
                    rel.workspaceId(), rel.id(), rel.runId(), rel.sourceFactId(), rel.sourceSection(),
                    rel.targetSection(), rel.referenceType(), rel.fieldName(), rel.rawValue(),
                    rel.valid(), rel.expected(), rel.confidence());
        }
    }

    @Override
    public List<NodeRelationship> findRelationships(String workspaceId, String runId) {
        return jdbcTemplate.query("""
                        SELECT * FROM node_relationships WHERE workspace_id = ? AND run_id = ?
                         ORDER BY source_section, target_section, id
                        """,
                relationshipMapper, workspaceId, runId);
    }

    // ── Eşleşmeler ──────────────────────────────────────────────────

    private final RowMapper<PatternMatch> matchMapper = (rs, rowNum) -> new PatternMatch(
            rs.getString("id"),
            rs.getString("workspace_id"),
            rs.getString("run_id"),
            rs.getString("fact_id"),
            rs.getString("pattern_id"),
            rs.getDouble("confidence"),
            Verdict.valueOf(rs.getString("verdict")),
            json.read(rs.getString("explanation_json"), MatchExplanation.class),
            JsonColumns.instant(rs.getTimestamp("created_at")));

    @Override
    public void saveMatches(List<PatternMatch> matches) {
        for (PatternMatch match : matches) {
            insertIgnoringDuplicate(match.id(), """
                            INSERT INTO pattern_matches (workspace_id, id, run_id, fact_id, pattern_id,
                                confidence, verdict, explanation_json, created_at)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                            """,
                    match.workspaceId(), match.id(), match.runId(), match.factId(), match.patternId(),
                    match.confidence(), match.verdict().name(), json.write(match.explanation()),
                    JsonColumns.timestamp(match.createdAt()));
        }
    }

    @Override
    public List<PatternMatch> findMatches(String workspaceId, String runId) {
        return jdbcTemplate.query("""
                        SELECT * FROM pattern_matches WHERE workspace_id = ? AND run_id = ?
                         ORDER BY created_at, id
                        """,
                matchMapper, workspaceId, runId);
    }

    private void insertIgnoringDuplicate(String id, String sql, Object... args) {
        try {
            jdbcTemplate.update(sql, args);
        } catch (DuplicateKeyException e) {
            log.debug("Kayıt zaten mevcut, yok sayıldı: {}", id);
        }
    }
}
