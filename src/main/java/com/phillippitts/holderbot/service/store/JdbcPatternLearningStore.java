package com.phillippitts.holderbot.service.store;

import com.phillippitts.holderbot.config.properties.FallbackProperties;
import com.phillippitts.holderbot.domain.Axis;
import com.phillippitts.holderbot.domain.BucketFunction;
import com.phillippitts.holderbot.domain.ConfusionTally;
import com.phillippitts.holderbot.domain.CorrectionEvent;
import com.phillippitts.holderbot.domain.PatternHypothesis;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.exception.InvalidSubjectException;
import com.phillippitts.holderbot.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * {@link PatternLearningStore} on Spring JDBC.
 *
 * <p>Upserts use {@code MERGE ... KEY}. Corrections run inside a {@link TransactionTemplate}
 * so the log entry, the verified record and every bucket hypothesis commit or roll back
 * together. Same-subject read-then-write paths additionally hold the subject's stripe from
 * {@link SubjectLockRegistry}.
 */
@Component
public class JdbcPatternLearningStore implements PatternLearningStore {

    private static final Logger LOG = LogManager.getLogger(JdbcPatternLearningStore.class);

    private static final String RECORD_COLUMNS =
            "subject_id, material, holder_type, confidence, source_kind, updated_at, verified, correction_count";

    private static final String MERGE_RECORD = "MERGE INTO subject_record (" + RECORD_COLUMNS + ") "
            + "KEY (subject_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_RECORD =
            "SELECT " + RECORD_COLUMNS + " FROM subject_record WHERE subject_id = ?";

    private static final String INSERT_CORRECTION = "INSERT INTO correction_event "
            + "(subject_id, material_before, holder_type_before, material_after, holder_type_after, corrected_at) "
            + "VALUES (?, ?, ?, ?, ?, ?)";

    private static final String CORRECTION_COLUMNS =
            "subject_id, material_before, holder_type_before, material_after, holder_type_after, corrected_at";

    private static final String SELECT_CONFUSIONS = "SELECT %1$s_before AS before_value, %1$s_after AS after_value, "
            + "COUNT(*) AS n, MAX(id) AS last_id, MAX(corrected_at) AS last_seen FROM correction_event "
            + "WHERE %1$s_before <> %1$s_after GROUP BY %1$s_before, %1$s_after "
            + "ORDER BY n DESC, last_id DESC LIMIT ?";

    private static final String INCREMENT_HYPOTHESIS = "UPDATE pattern_hypothesis "
            + "SET sample_count = sample_count + 1, last_updated = ? "
            + "WHERE bucket_type = ? AND bucket_value = ? AND material = ? AND holder_type = ?";

    private static final String INSERT_HYPOTHESIS = "INSERT INTO pattern_hypothesis "
            + "(bucket_type, bucket_value, material, holder_type, sample_count, success_rate, last_updated) "
            + "VALUES (?, ?, ?, ?, 1, 0, ?)";

    // success_rate is a share of the bucket, so every sibling changes when one hypothesis grows
    private static final String RECOMPUTE_SUCCESS_RATES = "UPDATE pattern_hypothesis "
            + "SET success_rate = CAST(sample_count AS DOUBLE PRECISION) / "
            + "(SELECT SUM(t.sample_count) FROM pattern_hypothesis t WHERE t.bucket_type = ? AND t.bucket_value = ?) "
            + "WHERE bucket_type = ? AND bucket_value = ?";

    private static final String HYPOTHESIS_COLUMNS =
            "bucket_type, bucket_value, material, holder_type, sample_count, success_rate, last_updated";

    private static final String SELECT_BUCKET = "SELECT " + HYPOTHESIS_COLUMNS + " FROM pattern_hypothesis "
            + "WHERE bucket_type = ? AND bucket_value = ? "
            + "ORDER BY sample_count DESC, success_rate DESC, last_updated DESC";

    private static final RowMapper<SubjectRecord> RECORD_MAPPER = (rs, rowNum) -> new SubjectRecord(
            rs.getString("subject_id"),
            rs.getString("material"),
            rs.getString("holder_type"),
            rs.getDouble("confidence"),
            SourceKind.valueOf(rs.getString("source_kind")),
            rs.getTimestamp("updated_at").toInstant(),
            rs.getBoolean("verified"),
            rs.getInt("correction_count"));

    private static final RowMapper<CorrectionEvent> CORRECTION_MAPPER = (rs, rowNum) -> new CorrectionEvent(
            rs.getString("subject_id"),
            rs.getString("material_before"),
            rs.getString("holder_type_before"),
            rs.getString("material_after"),
            rs.getString("holder_type_after"),
            rs.getTimestamp("corrected_at").toInstant());

    private static final RowMapper<PatternHypothesis> HYPOTHESIS_MAPPER = (rs, rowNum) -> new PatternHypothesis(
            BucketFunction.fromKey(rs.getString("bucket_type"))
                    .orElseThrow(() -> new IllegalStateException("Unknown bucket type in store")),
            rs.getLong("bucket_value"),
            rs.getString("material"),
            rs.getString("holder_type"),
            rs.getInt("sample_count"),
            rs.getDouble("success_rate"),
            rs.getTimestamp("last_updated").toInstant());

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SubjectLockRegistry locks;
    private final FallbackProperties fallback;

    public JdbcPatternLearningStore(JdbcTemplate jdbcTemplate,
                                    TransactionTemplate transactionTemplate,
                                    SubjectLockRegistry locks,
                                    FallbackProperties fallback) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate);
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate);
        this.locks = Objects.requireNonNull(locks);
        this.fallback = Objects.requireNonNull(fallback);
    }

    @Override
    public void storeAnalysis(SubjectRecord record) {
        Objects.requireNonNull(record, "record");
        locks.withLock(record.subjectId(), () -> guarded("storeAnalysis", record.subjectId(), () -> {
            upsert(record);
            return null;
        }));
    }

    @Override
    public boolean storeAnalysisUnlessVerified(SubjectRecord record) {
        Objects.requireNonNull(record, "record");
        String id = record.subjectId();
        return locks.withLock(id, () -> guarded("storeAnalysisUnlessVerified", id, () ->
                Boolean.TRUE.equals(transactionTemplate.execute(status -> {
                    Optional<SubjectRecord> current = findRecord(id);
                    if (current.isPresent() && current.get().verified()) {
                        LOG.debug("Verified record kept; engine write-back skipped for subject={}", id);
                        return false;
                    }
                    int count = current.map(SubjectRecord::correctionCount).orElse(0);
                    upsert(record.withCorrectionCount(count));
                    return true;
                }))));
    }

    @Override
    public Optional<SubjectRecord> getAnalysis(String subjectId) {
        String id = requireSubjectId(subjectId);
        return guarded("getAnalysis", id, () -> findRecord(id));
    }

    @Override
    public AppliedCorrection applyCorrection(String subjectId, String materialAfter, String typeAfter) {
        String id = requireSubjectId(subjectId);
        String material = requireValue("material", materialAfter);
        String type = requireValue("type", typeAfter);

        AppliedCorrection applied = locks.withLock(id, () -> guarded("applyCorrection", id, () ->
                transactionTemplate.execute(status -> doApplyCorrection(id, material, type))));
        LOG.info("Correction applied: subject={}, {} / {} -> {} / {}, corrections={}",
                id, applied.event().materialBefore(), applied.event().typeBefore(),
                material, type, applied.updated().correctionCount());
        return applied;
    }

    private AppliedCorrection doApplyCorrection(String id, String material, String type) {
        Instant now = Instant.now();
        SubjectRecord previous = findRecord(id).orElse(null);
        String materialBefore = previous != null ? previous.material() : fallback.getMaterial();
        String typeBefore = previous != null ? previous.type() : fallback.getType();

        jdbcTemplate.update(INSERT_CORRECTION, id, materialBefore, typeBefore, material, type, ts(now));

        int corrections = previous != null ? previous.correctionCount() + 1 : 1;
        SubjectRecord updated = new SubjectRecord(id, material, type, 1.0, SourceKind.CORRECTION,
                now, true, corrections);
        upsert(updated);

        OptionalLong numeric = BucketFunction.numericId(id);
        if (numeric.isPresent()) {
            for (BucketFunction fn : BucketFunction.values()) {
                learn(fn, fn.apply(numeric.getAsLong()), material, type, now);
            }
        } else {
            LOG.debug("Non-numeric subject id, no pattern learning: subject={}", id);
        }

        CorrectionEvent event = new CorrectionEvent(id, materialBefore, typeBefore, material, type, now);
        return new AppliedCorrection(event, previous, updated);
    }

    private void learn(BucketFunction fn, long bucketValue, String material, String type, Instant now) {
        int rows = jdbcTemplate.update(INCREMENT_HYPOTHESIS, ts(now), fn.key(), bucketValue, material, type);
        if (rows == 0) {
            jdbcTemplate.update(INSERT_HYPOTHESIS, fn.key(), bucketValue, material, type, ts(now));
        }
        jdbcTemplate.update(RECOMPUTE_SUCCESS_RATES, fn.key(), bucketValue, fn.key(), bucketValue);
    }

    @Override
    public Optional<PatternHypothesis> queryLearnedPrediction(String subjectId) {
        OptionalLong numeric = BucketFunction.numericId(subjectId);
        if (numeric.isEmpty()) {
            return Optional.empty();
        }
        long id = numeric.getAsLong();
        return guarded("queryLearnedPrediction", subjectId, () -> {
            PatternHypothesis best = null;
            for (BucketFunction fn : BucketFunction.values()) {
                List<PatternHypothesis> top = jdbcTemplate.query(SELECT_BUCKET + " LIMIT 1",
                        HYPOTHESIS_MAPPER, fn.key(), fn.apply(id));
                if (top.isEmpty()) {
                    continue;
                }
                PatternHypothesis candidate = top.get(0);
                if (best == null || candidate.derivedConfidence() > best.derivedConfidence()) {
                    best = candidate;
                }
            }
            return Optional.ofNullable(best);
        });
    }

    @Override
    public int importRecords(List<SubjectRecord> records) {
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            return 0;
        }
        List<String> ids = records.stream().map(SubjectRecord::subjectId).toList();
        Integer written = locks.withLocks(ids, () -> guarded("importRecords", null, () ->
                transactionTemplate.execute(status -> {
                    int n = 0;
                    for (SubjectRecord r : records) {
                        // the correction log stays authoritative for correction_count
                        int count = findRecord(r.subjectId()).map(SubjectRecord::correctionCount).orElse(0);
                        upsert(new SubjectRecord(r.subjectId(), r.material(), r.type(), r.confidence(),
                                SourceKind.IMPORTED, r.timestamp(), true, count));
                        n++;
                    }
                    return n;
                })));
        LOG.info("Imported {} verified records", written);
        return written == null ? 0 : written;
    }

    @Override
    public List<SubjectRecord> findAll() {
        return guarded("findAll", null, () -> jdbcTemplate.query(
                "SELECT " + RECORD_COLUMNS + " FROM subject_record ORDER BY updated_at DESC, subject_id",
                RECORD_MAPPER));
    }

    @Override
    public List<CorrectionEvent> corrections() {
        return guarded("corrections", null, () -> jdbcTemplate.query(
                "SELECT " + CORRECTION_COLUMNS + " FROM correction_event ORDER BY id", CORRECTION_MAPPER));
    }

    @Override
    public List<CorrectionEvent> correctionsFor(String subjectId) {
        String id = requireSubjectId(subjectId);
        return guarded("correctionsFor", id, () -> jdbcTemplate.query(
                "SELECT " + CORRECTION_COLUMNS + " FROM correction_event WHERE subject_id = ? ORDER BY id",
                CORRECTION_MAPPER, id));
    }

    @Override
    public List<ConfusionTally> topConfusions(Axis axis, int limit) {
        Objects.requireNonNull(axis, "axis");
        if (limit <= 0) {
            return List.of();
        }
        String column = axis == Axis.MATERIAL ? "material" : "holder_type";
        return guarded("topConfusions", null, () -> jdbcTemplate.query(
                String.format(SELECT_CONFUSIONS, column),
                (rs, rowNum) -> new ConfusionTally(axis, rs.getString("before_value"), rs.getString("after_value"),
                        rs.getLong("n"), rs.getTimestamp("last_seen").toInstant()),
                limit));
    }

    @Override
    public List<PatternHypothesis> hypothesesFor(BucketFunction bucketType, long bucketValue) {
        Objects.requireNonNull(bucketType, "bucketType");
        return guarded("hypothesesFor", null, () ->
                jdbcTemplate.query(SELECT_BUCKET, HYPOTHESIS_MAPPER, bucketType.key(), bucketValue));
    }

    @Override
    public StoreStatistics statistics() {
        return guarded("statistics", null, () -> {
            long analysed = count("SELECT COUNT(*) FROM subject_record");
            long verified = count("SELECT COUNT(*) FROM subject_record WHERE verified = TRUE");
            long corrections = count("SELECT COUNT(*) FROM correction_event");
            long hypotheses = count("SELECT COUNT(*) FROM pattern_hypothesis");
            double accuracy = verified == 0 ? 0.0 : Math.max(0.0, (verified - corrections) / (double) verified);

            Map<SourceKind, StoreStatistics.SourceStats> bySource = new EnumMap<>(SourceKind.class);
            jdbcTemplate.query("SELECT source_kind, COUNT(*) AS n, AVG(confidence) AS avg_conf "
                    + "FROM subject_record GROUP BY source_kind", rs -> {
                bySource.put(SourceKind.valueOf(rs.getString("source_kind")),
                        new StoreStatistics.SourceStats(rs.getLong("n"), rs.getDouble("avg_conf")));
            });
            return new StoreStatistics(analysed, verified, corrections, hypotheses, accuracy, bySource);
        });
    }

    private long count(String sql) {
        Long n = jdbcTemplate.queryForObject(sql, Long.class);
        return n == null ? 0L : n;
    }

    private Optional<SubjectRecord> findRecord(String id) {
        List<SubjectRecord> rows = jdbcTemplate.query(SELECT_RECORD, RECORD_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private void upsert(SubjectRecord r) {
        jdbcTemplate.update(MERGE_RECORD, r.subjectId(), r.material(), r.type(), r.confidence(),
                r.sourceKind().name(), ts(r.timestamp()), r.verified(), r.correctionCount());
    }

    private static <T> T guarded(String operation, String subjectId, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            LOG.error("Store operation {} failed (subject={}): {}", operation, subjectId, e.getMessage());
            throw subjectId == null
                    ? new StorageException(operation, e)
                    : new StorageException(operation, subjectId, e);
        }
    }

    private static Timestamp ts(Instant instant) {
        return Timestamp.from(instant);
    }

    private static String requireSubjectId(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new InvalidSubjectException("subject id must not be blank");
        }
        return subjectId.strip();
    }

    private static String requireValue(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidSubjectException(name + " must not be blank");
        }
        return value.strip();
    }
}
