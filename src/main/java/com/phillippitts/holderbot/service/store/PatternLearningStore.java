package com.phillippitts.holderbot.service.store;

import com.phillippitts.holderbot.domain.Axis;
import com.phillippitts.holderbot.domain.BucketFunction;
import com.phillippitts.holderbot.domain.ConfusionTally;
import com.phillippitts.holderbot.domain.CorrectionEvent;
import com.phillippitts.holderbot.domain.PatternHypothesis;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.exception.InvalidSubjectException;
import com.phillippitts.holderbot.exception.StorageException;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-subject records, the append-only correction log and the learned bucket
 * hypotheses. The only component allowed to mutate any of them.
 *
 * <p>Every read-then-write on one subject id is serialized per id; distinct ids proceed in
 * parallel. All storage faults surface as {@link StorageException}.
 */
public interface PatternLearningStore {

    /**
     * Upserts a record keyed by its subject id. Values are stored exactly as given.
     *
     * @throws StorageException on any I/O fault
     */
    void storeAnalysis(SubjectRecord record);

    /**
     * Engine write-back: upserts the record unless a verified record already exists for the
     * subject. The existing correction count is preserved.
     *
     * @return true if the record was written, false if a verified record blocked it
     * @throws StorageException on any I/O fault
     */
    boolean storeAnalysisUnlessVerified(SubjectRecord record);

    Optional<SubjectRecord> getAnalysis(String subjectId);

    /**
     * Applies a human correction as one atomic unit: appends the correction event, marks the
     * record verified with confidence 1.0, and (for numeric ids) teaches every bucket
     * function the corrected pair. Any fault rolls back all three.
     *
     * @throws InvalidSubjectException if the id or a value is blank
     * @throws StorageException if the unit of work failed; nothing was changed
     */
    AppliedCorrection applyCorrection(String subjectId, String materialAfter, String typeAfter);

    /**
     * Best learned hypothesis across bucket functions, ranked by derived confidence.
     * Empty for non-numeric ids or ids whose buckets have never been corrected.
     */
    Optional<PatternHypothesis> queryLearnedPrediction(String subjectId);

    /**
     * Loads records as verified imported rows in one transaction. Existing correction counts
     * are kept.
     *
     * @return number of rows written
     */
    int importRecords(List<SubjectRecord> records);

    /** Every record, most recently written first. */
    List<SubjectRecord> findAll();

    /** The whole correction log in append order. */
    List<CorrectionEvent> corrections();

    List<CorrectionEvent> correctionsFor(String subjectId);

    /**
     * The {@code limit} most frequent (before, after) pairs of the correction log on one axis,
     * most frequent first, ties going to the more recent correction. Corrections that kept the
     * value are not counted.
     */
    List<ConfusionTally> topConfusions(Axis axis, int limit);

    /** Competing hypotheses of one bucket, strongest first. */
    List<PatternHypothesis> hypothesesFor(BucketFunction bucketType, long bucketValue);

    StoreStatistics statistics();
}
