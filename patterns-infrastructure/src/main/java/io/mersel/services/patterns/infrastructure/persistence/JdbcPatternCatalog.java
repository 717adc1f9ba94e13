package io.mersel.services.patterns.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mersel.services.patterns.application.enums.DeltaType;
import io.mersel.services.patterns.application.interfaces.IPatternCatalog;
import io.mersel.services.patterns.application.models.CandidateScope;
import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternDelta;
import io.mersel.services.patterns.infrastructure.config.PatternEngineProperties;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * JDBC tabanlı pattern kataloğu.
 * <p>
 * Upsert, {@code (workspace_id, signature_hash)} tekil kısıtına dayanır: iki çalıştırma
 * aynı imzayı aynı anda eklemeye çalışırsa kaybeden taraf {@link DuplicateKeyException}
 * alır ve yeni bir transaction'da güncelleme olarak tekrar dener.
 * {@code pattern_sightings} satırı, aynı çalıştırmanın tekrar işlenmesinde sayacın
 * ikinci kez artmasını engeller.
 * <p>
 * Mevcut imzada karar kuralı birleştirilerek tazelenir: opsiyonel attribute'lar
 * birleşim olarak büyür, beklenen ilişki özetleri hedef section bazında toplanır.
 * Aynı çalıştırmanın tekrarında gözlem sayıları ikinci kez eklenmez.
 */
@Repository
public class JdbcPatternCatalog implements IPatternCatalog {

    private static final Logger log = LoggerFactory.getLogger(JdbcPatternCatalog.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String COLUMNS = """
            id, workspace_id, schema_version, message_root, section_path, node_type, owner_code,
            rule_json, signature_hash, times_seen, superseded_by, examples_json, description,
            first_seen_at, last_seen_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final PatternMetrics metrics;
    private final JsonColumns json = new JsonColumns();
    private final int maxExamples;
    private final int maxAttempts;

    @Autowired
    public JdbcPatternCatalog(JdbcTemplate jdbcTemplate,
                              PlatformTransactionManager transactionManager,
                              PatternMetrics metrics,
                              PatternEngineProperties properties) {
        this(jdbcTemplate, transactionManager, metrics, properties.getMaxExamples(), properties.getUpsertMaxAttempts());
    }

    JdbcPatternCatalog(JdbcTemplate jdbcTemplate,
                       PlatformTransactionManager transactionManager,
                       PatternMetrics metrics,
                       int maxExamples,
                       int maxAttempts) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metrics = metrics;
        this.maxExamples = maxExamples;
        this.maxAttempts = maxAttempts;
    }

    private final RowMapper<Pattern> patternMapper = (rs, rowNum) -> new Pattern(
            rs.getString("id"),
            rs.getString("workspace_id"),
            rs.getString("schema_version"),
            rs.getString("message_root"),
            rs.getString("section_path"),
            rs.getString("node_type"),
            rs.getString("owner_code"),
            json.read(rs.getString("rule_json"), DecisionRule.class),
            rs.getString("signature_hash"),
            rs.getLong("times_seen"),
            rs.getString("superseded_by"),
            json.read(rs.getString("examples_json"), STRING_LIST, List.of()),
            rs.getString("description"),
            JsonColumns.instant(rs.getTimestamp("first_seen_at")),
            JsonColumns.instant(rs.getTimestamp("last_seen_at")));

    // ── Upsert ──────────────────────────────────────────────────────

    @Override
    public PatternDelta upsert(Pattern candidate, String runId) {
        DuplicateKeyException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionTemplate.execute(status -> upsertOnce(candidate, runId));
            } catch (DuplicateKeyException e) {
                lastConflict = e;
                metrics.recordUpsertConflict();
                log.debug("[{}] İmza çakışması, upsert tekrar deneniyor ({}/{}): {}",
                        runId, attempt, maxAttempts, candidate.signatureHash());
            }
        }
        throw new IllegalStateException("Pattern upsert " + maxAttempts + " denemede tamamlanamadı: "
                + candidate.signatureHash(), lastConflict);
    }

    private PatternDelta upsertOnce(Pattern candidate, String runId) {
        String ws = candidate.workspaceId();
        Instant now = Instant.now();
        Optional<Pattern> existing = findBySignature(ws, candidate.signatureHash());

        if (existing.isEmpty()) {
            String id = UUID.randomUUID().toString();
            jdbcTemplate.update("""
                            INSERT INTO patterns (id, workspace_id, schema_version, message_root, section_path,
                                node_type, owner_code, rule_json, signature_hash, times_seen, superseded_by,
                                examples_json, description, first_seen_at, last_seen_at)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 1, NULL, ?, ?, ?, ?)
                            """,
                    id, ws, candidate.version(), candidate.messageRoot(), candidate.sectionPath(),
                    candidate.nodeType(), candidate.ownerCode(), json.write(candidate.rule()),
                    candidate.signatureHash(), json.write(lastExamples(List.of(), candidate.examples())),
                    candidate.description(), JsonColumns.timestamp(now), JsonColumns.timestamp(now));
            insertSighting(ws, id, runId, now);
            return new PatternDelta(id, candidate.signatureHash(), candidate.sectionPath(),
                    candidate.nodeType(), DeltaType.CREATED, 1);
        }

        Pattern current = existing.get();
        boolean alreadySeen = sightingExists(ws, current.id(), runId);
        if (!alreadySeen) {
            insertSighting(ws, current.id(), runId, now);
        }
        jdbcTemplate.update("""
                        UPDATE patterns
                           SET times_seen = times_seen + ?, rule_json = ?, examples_json = ?, last_seen_at = ?
                         WHERE workspace_id = ? AND id = ?
                        """,
                alreadySeen ? 0 : 1, json.write(mergeRule(current.rule(), candidate.rule(), !alreadySeen)),
                json.write(lastExamples(current.examples(), candidate.examples())),
                JsonColumns.timestamp(now), ws, current.id());

        long timesSeen = current.timesSeen() + (alreadySeen ? 0 : 1);
        return new PatternDelta(current.id(), current.signatureHash(), current.sectionPath(), current.nodeType(),
                alreadySeen ? DeltaType.REFRESHED : DeltaType.INCREMENTED, timesSeen);
    }

    private boolean sightingExists(String workspaceId, String patternId, String runId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM pattern_sightings WHERE workspace_id = ? AND pattern_id = ? AND run_id = ?",
                Integer.class, workspaceId, patternId, runId);
        return count != null && count > 0;
    }

    private void insertSighting(String workspaceId, String patternId, String runId, Instant now) {
        jdbcTemplate.update(
                "INSERT INTO pattern_sightings (workspace_id, pattern_id, run_id, seen_at) VALUES (?, ?, ?, ?)",
                workspaceId, patternId, runId, JsonColumns.timestamp(now));
    }

    /**
     * Saklı kuralı yeni gözlemle birleştirir. Kimlik alanları (zorunlu attribute,
     * çocuk yapısı, referans tipleri) aynı imza altında değişmez ve adaydan alınır.
     *
     * @param absorbCounts yeni gözlemin ilişki sayıları eklensin mi
     */
    static DecisionRule mergeRule(DecisionRule stored, DecisionRule observed, boolean absorbCounts) {
        var optional = new TreeSet<>(stored.optionalAttributes());
        optional.addAll(observed.optionalAttributes());
        optional.removeAll(observed.requiredAttributes());

        Map<String, DecisionRule.ExpectedRelationship> byTarget = new TreeMap<>();
        for (var expected : stored.expectedRelationships()) {
            byTarget.put(expected.targetSection(), expected);
        }
        if (absorbCounts) {
            for (var incoming : observed.expectedRelationships()) {
                byTarget.merge(incoming.targetSection(), incoming, JdbcPatternCatalog::sumRelationship);
            }
        }

        return new DecisionRule(observed.nodeType(), observed.sectionPath(), observed.requiredAttributes(),
                List.copyOf(optional), observed.childShapes(), observed.referenceTypes(),
                List.copyOf(byTarget.values()));
    }

    private static DecisionRule.ExpectedRelationship sumRelationship(DecisionRule.ExpectedRelationship a,
                                                                     DecisionRule.ExpectedRelationship b) {
        var types = new TreeSet<>(a.referenceTypes());
        types.addAll(b.referenceTypes());
        int valid = a.validCount() + b.validCount();
        int broken = a.brokenCount() + b.brokenCount();
        return new DecisionRule.ExpectedRelationship(a.targetSection(), List.copyOf(types), valid, broken, broken == 0);
    }

    private List<String> lastExamples(List<String> existing, List<String> incoming) {
        var merged = new LinkedHashSet<String>(existing);
        for (String example : incoming) {
            merged.remove(example);
            merged.add(example);
        }
        var list = new ArrayList<>(merged);
        return list.size() <= maxExamples ? list : new ArrayList<>(list.subList(list.size() - maxExamples, list.size()));
    }

    // ── Sorgular ────────────────────────────────────────────────────

    @Override
    public Optional<Pattern> findById(String workspaceId, String patternId) {
        return single("SELECT " + COLUMNS + " FROM patterns WHERE workspace_id = ? AND id = ?",
                workspaceId, patternId);
    }

    @Override
    public Optional<Pattern> findBySignature(String workspaceId, String signatureHash) {
        return single("SELECT " + COLUMNS + " FROM patterns WHERE workspace_id = ? AND signature_hash = ?",
                workspaceId, signatureHash);
    }

    private Optional<Pattern> single(String sql, Object... args) {
        List<Pattern> rows = jdbcTemplate.query(sql, patternMapper, args);
        if (rows.size() > 1) {
            throw new IncorrectResultSizeDataAccessException(1, rows.size());
        }
        return rows.stream().findFirst();
    }

    @Override
    public List<Pattern> findCandidates(CandidateScope scope) {
        var sql = new StringBuilder("SELECT ").append(COLUMNS)
                .append(" FROM patterns WHERE workspace_id = ? AND message_root = ? AND superseded_by IS NULL");
        var args = new ArrayList<Object>();
        args.add(scope.workspaceId());
        args.add(scope.messageRoot());
        if (!scope.crossVersion()) {
            sql.append(" AND schema_version = ?");
            args.add(scope.version());
        }
        if (scope.ownerScoped() && scope.ownerCode() != null) {
            sql.append(" AND (owner_code = ? OR owner_code IS NULL)");
            args.add(scope.ownerCode());
        }
        sql.append(" ORDER BY section_path, id");
        return jdbcTemplate.query(sql.toString(), patternMapper, args.toArray());
    }

    @Override
    public List<Pattern> findActive(String workspaceId, String version, String messageRoot) {
        return jdbcTemplate.query("SELECT " + COLUMNS + """
                         FROM patterns
                        WHERE workspace_id = ? AND schema_version = ? AND message_root = ? AND superseded_by IS NULL
                        ORDER BY section_path, id
                        """,
                patternMapper, workspaceId, version, messageRoot);
    }

    // ── Güncellemeler ───────────────────────────────────────────────

    @Override
    public void incrementTimesSeen(String workspaceId, String patternId) {
        jdbcTemplate.update("""
                        UPDATE patterns SET times_seen = times_seen + 1, last_seen_at = ?
                         WHERE workspace_id = ? AND id = ?
                        """,
                JsonColumns.timestamp(Instant.now()), workspaceId, patternId);
    }

    @Override
    public void markSuperseded(String workspaceId, String patternId, String supersededBy) {
        jdbcTemplate.update("UPDATE patterns SET superseded_by = ? WHERE workspace_id = ? AND id = ?",
                supersededBy, workspaceId, patternId);
    }

    @Override
    public void updateDescription(String workspaceId, String patternId, String description) {
        jdbcTemplate.update("UPDATE patterns SET description = ? WHERE workspace_id = ? AND id = ?",
                description, workspaceId, patternId);
    }
}
