package com.phillippitts.holderbot.service.calibration;

import com.phillippitts.holderbot.config.properties.CalibrationProperties;
import com.phillippitts.holderbot.domain.AccuracyTrend;
import com.phillippitts.holderbot.domain.Axis;
import com.phillippitts.holderbot.domain.CalibrationBin;
import com.phillippitts.holderbot.domain.CalibrationJudgement;
import com.phillippitts.holderbot.domain.ConfusionTally;
import com.phillippitts.holderbot.exception.StorageException;
import com.phillippitts.holderbot.service.events.CorrectionAppliedEvent;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Confidence calibration and error analysis.
 *
 * <p>Keeps a persisted outcome log ({@code prediction_outcome}): each row is one prediction
 * whose correctness became known, binned by confidence decile and stamped with the running
 * accuracy after it. Bins, the accuracy trend and the report are projections of that log.
 * Confusion tallies are grouped by the store over its correction log on each request.
 *
 * <p>Corrections feed this service through {@link CorrectionAppliedEvent}: when the corrected
 * subject held an unverified prediction, its confidence and whether the human kept both
 * values are recorded as an outcome.
 */
@Service
public class CalibrationService implements LearnedHints {

    private static final Logger LOG = LogManager.getLogger(CalibrationService.class);

    private static final String INSERT_OUTCOME = "INSERT INTO prediction_outcome "
            + "(predicted_confidence, bin_level, was_correct, running_accuracy, recorded_at) VALUES (?, ?, ?, ?, ?)";

    private static final String SELECT_BINS = "SELECT bin_level, COUNT(*) AS total, "
            + "SUM(CASE WHEN was_correct THEN 1 ELSE 0 END) AS correct "
            + "FROM prediction_outcome GROUP BY bin_level ORDER BY bin_level";

    private final JdbcTemplate jdbcTemplate;
    private final PatternLearningStore store;
    private final CalibrationProperties properties;

    public CalibrationService(JdbcTemplate jdbcTemplate, PatternLearningStore store,
                              CalibrationProperties properties) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate);
        this.store = Objects.requireNonNull(store);
        this.properties = Objects.requireNonNull(properties);
    }

    /**
     * Records that a prediction made at {@code predictedConfidence} turned out correct or not.
     *
     * @throws IllegalArgumentException if the confidence is outside [0, 1]
     * @throws StorageException if the outcome could not be persisted
     */
    public synchronized void recordOutcome(double predictedConfidence, boolean wasCorrect) {
        if (Double.isNaN(predictedConfidence) || predictedConfidence < 0.0 || predictedConfidence > 1.0) {
            throw new IllegalArgumentException("predictedConfidence must be in [0,1], got: " + predictedConfidence);
        }
        int level = CalibrationBin.levelOf(predictedConfidence);
        guarded("recordOutcome", () -> {
            long[] totals = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) AS n, COALESCE(SUM(CASE WHEN was_correct THEN 1 ELSE 0 END), 0) AS ok "
                            + "FROM prediction_outcome",
                    (rs, rowNum) -> new long[]{rs.getLong("n"), rs.getLong("ok")});
            long n = totals[0] + 1;
            long ok = totals[1] + (wasCorrect ? 1 : 0);
            double running = ok / (double) n;
            jdbcTemplate.update(INSERT_OUTCOME, predictedConfidence, level, wasCorrect, running,
                    Timestamp.from(Instant.now()));
            LOG.debug("Outcome recorded: level={}, correct={}, runningAccuracy={}", level, wasCorrect, running);
            return null;
        });
    }

    /** Non-empty bins, lowest level first. */
    public List<CalibrationBin> bins() {
        return guarded("bins", () -> jdbcTemplate.query(SELECT_BINS, (rs, rowNum) ->
                new CalibrationBin(rs.getInt("bin_level"), rs.getLong("total"), rs.getLong("correct"))));
    }

    public List<BinReport> binReports() {
        return bins().stream()
                .map(b -> BinReport.of(b, properties.getMargin(), properties.getMinSamples()))
                .toList();
    }

    /**
     * {@code |accuracy − level|} of one decile; empty when nothing was recorded there.
     */
    public OptionalDouble calibrationError(int level) {
        return bins().stream()
                .filter(b -> b.level() == level)
                .mapToDouble(CalibrationBin::calibrationError)
                .findFirst();
    }

    /**
     * The {@code n} most frequent (before, after) pairs on one axis, most frequent first, ties
     * going to the more recent correction. Corrections that kept the value are not confusions.
     */
    public List<ConfusionTally> topConfusions(Axis axis, int n) {
        Objects.requireNonNull(axis, "axis");
        return store.topConfusions(axis, n);
    }

    /**
     * Compares the mean running accuracy of the latest window of snapshots with the window
     * before it. Stable until two full windows exist.
     */
    public AccuracyTrend accuracyTrend() {
        int window = properties.getTrendWindow();
        List<Double> latestFirst = guarded("accuracyTrend", () -> jdbcTemplate.queryForList(
                "SELECT running_accuracy FROM prediction_outcome ORDER BY id DESC LIMIT ?",
                Double.class, window * 2));
        if (latestFirst.size() < window * 2) {
            return AccuracyTrend.STABLE;
        }
        double recent = mean(latestFirst.subList(0, window));
        double prior = mean(latestFirst.subList(window, window * 2));
        double delta = recent - prior;
        if (delta > properties.getTrendDelta()) {
            return AccuracyTrend.IMPROVING;
        }
        if (delta < -properties.getTrendDelta()) {
            return AccuracyTrend.DECLINING;
        }
        return AccuracyTrend.STABLE;
    }

    public CalibrationReport report() {
        List<BinReport> bins = binReports();
        int limit = Math.max(properties.getHintLimit(), 1);
        List<ConfusionTally> materials = topConfusions(Axis.MATERIAL, limit);
        List<ConfusionTally> types = topConfusions(Axis.TYPE, limit);
        AccuracyTrend trend = accuracyTrend();

        long total = bins.stream().mapToLong(BinReport::total).sum();
        long correct = bins.stream().mapToLong(BinReport::correct).sum();
        double accuracy = total == 0 ? 0.0 : correct / (double) total;

        return new CalibrationReport(bins, materials, types, total, accuracy, trend,
                recommendations(bins, materials, types, trend));
    }

    private List<String> recommendations(List<BinReport> bins, List<ConfusionTally> materials,
                                         List<ConfusionTally> types, AccuracyTrend trend) {
        List<String> out = new ArrayList<>();
        if (!materials.isEmpty()) {
            ConfusionTally top = materials.get(0);
            out.add("Focus on distinguishing material " + top.before() + " from " + top.after()
                    + " (corrected " + top.count() + " times)");
        }
        if (!types.isEmpty()) {
            ConfusionTally top = types.get(0);
            out.add("Focus on distinguishing type " + top.before() + " from " + top.after()
                    + " (corrected " + top.count() + " times)");
        }
        String over = levels(bins, CalibrationJudgement.OVERCONFIDENT);
        if (!over.isEmpty()) {
            out.add("Predictions are overconfident at " + over
                    + ": use more conservative confidence scoring");
        }
        String under = levels(bins, CalibrationJudgement.UNDERCONFIDENT);
        if (!under.isEmpty()) {
            out.add("Predictions are underconfident at " + under + ": confidence can be raised");
        }
        if (trend == AccuracyTrend.DECLINING) {
            out.add("Accuracy is declining: review the most recent corrections");
        }
        return out;
    }

    private static String levels(List<BinReport> bins, CalibrationJudgement judgement) {
        return bins.stream()
                .filter(b -> b.judgement() == judgement)
                .map(b -> b.level() + "%")
                .collect(Collectors.joining(", "));
    }

    /**
     * Oracle instruction lines derived from the most frequent corrections and from
     * overconfident bins. Never throws: a failing store yields no hints.
     */
    @Override
    public List<String> hints() {
        try {
            List<ConfusionTally> all = new ArrayList<>(topConfusions(Axis.MATERIAL, properties.getHintLimit()));
            all.addAll(topConfusions(Axis.TYPE, properties.getHintLimit()));
            all.sort(Comparator.comparingLong(ConfusionTally::count)
                    .thenComparing(ConfusionTally::lastSeen).reversed());

            List<String> hints = new ArrayList<>();
            for (ConfusionTally t : all.subList(0, Math.min(all.size(), properties.getHintLimit()))) {
                hints.add("Common mistake: do not confuse " + t.before() + " with " + t.after()
                        + " (corrected " + t.count() + " times).");
            }
            boolean overconfident = binReports().stream()
                    .anyMatch(b -> b.judgement() == CalibrationJudgement.OVERCONFIDENT);
            if (overconfident) {
                hints.add("You tend to be overconfident: use confidence above 0.8 only when "
                        + "the visual evidence is unambiguous.");
            }
            return hints;
        } catch (StorageException e) {
            LOG.warn("Learned hints unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Turns a committed correction of an unverified prediction into an outcome.
     */
    @EventListener
    public void onCorrectionApplied(CorrectionAppliedEvent event) {
        if (!event.correctsPrediction()) {
            return;
        }
        boolean correct = event.correction().confirmsPrediction();
        try {
            recordOutcome(event.previous().confidence(), correct);
        } catch (StorageException e) {
            // the correction itself is committed; only calibration loses this sample
            LOG.warn("Outcome for subject={} not recorded: {}", event.correction().subjectId(), e.getMessage());
        }
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException(operation, e);
        }
    }
}
