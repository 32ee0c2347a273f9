package com.phillippitts.holderbot.service.aggregation;

import com.phillippitts.holderbot.config.properties.AggregationProperties;
import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.config.properties.FallbackProperties;
import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.exception.VisionOracleException;
import com.phillippitts.holderbot.service.calibration.LearnedHints;
import com.phillippitts.holderbot.service.events.RegionAnalysisFailedEvent;
import com.phillippitts.holderbot.service.metrics.DecisionMetrics;
import com.phillippitts.holderbot.service.oracle.RegionImage;
import com.phillippitts.holderbot.service.oracle.VisionOracle;
import com.phillippitts.holderbot.service.photo.Photograph;
import com.phillippitts.holderbot.service.voting.Ballot;
import com.phillippitts.holderbot.service.voting.VoteResult;
import com.phillippitts.holderbot.service.voting.WeightedVoter;
import com.phillippitts.holderbot.util.LogSanitizer;
import com.phillippitts.holderbot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link MultiRegionAggregator}.
 *
 * <p>Every {@link AnalysisRegion} is cropped and sent to the oracle on the bounded
 * {@code oracleExecutor}. Each call is bounded by {@code holderbot.aggregation.region-timeout-ms};
 * a failed, timed-out, unparseable or low-confidence region is discarded and reported through a
 * {@link RegionAnalysisFailedEvent}. Voting starts only after every region has settled.
 *
 * <p>Survivors vote through {@link WeightedVoter} with each reply's confidence as its weight.
 */
@Service
public class DefaultMultiRegionAggregator implements MultiRegionAggregator {
    private static final Logger LOG = LogManager.getLogger(DefaultMultiRegionAggregator.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_ORACLE_ERROR = "oracle_error";
    static final String REASON_UNPARSEABLE = "unparseable";
    static final String REASON_LOW_CONFIDENCE = "low_confidence";
    static final String REASON_UNEXPECTED = "unexpected_error";

    private final VisionOracle oracle;
    private final RegionCropper cropper;
    private final OracleReplyParser parser;
    private final LearnedHints hints;
    private final Executor executor;
    private final AggregationProperties properties;
    private final FallbackProperties fallback;
    private final EnsembleProperties ensemble;
    private final DecisionMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public DefaultMultiRegionAggregator(VisionOracle oracle,
                                        RegionCropper cropper,
                                        OracleReplyParser parser,
                                        LearnedHints hints,
                                        @Qualifier("oracleExecutor") Executor executor,
                                        AggregationProperties properties,
                                        FallbackProperties fallback,
                                        EnsembleProperties ensemble,
                                        DecisionMetrics metrics,
                                        ApplicationEventPublisher publisher) {
        this.oracle = Objects.requireNonNull(oracle);
        this.cropper = Objects.requireNonNull(cropper);
        this.parser = Objects.requireNonNull(parser);
        this.hints = hints == null ? LearnedHints.NONE : hints;
        this.executor = Objects.requireNonNull(executor);
        this.properties = Objects.requireNonNull(properties);
        this.fallback = Objects.requireNonNull(fallback);
        this.ensemble = Objects.requireNonNull(ensemble);
        this.metrics = metrics;
        this.publisher = Objects.requireNonNull(publisher);
    }

    @Override
    public Observation aggregate(String subjectId, Photograph photograph) {
        Objects.requireNonNull(photograph, "photograph");
        long t0 = System.nanoTime();
        List<String> learned = hints.hints();

        List<CompletableFuture<RegionVerdict>> futures = new ArrayList<>();
        for (AnalysisRegion region : AnalysisRegion.values()) {
            String instruction = region.instruction(learned);
            CompletableFuture<RegionVerdict> f = CompletableFuture
                    .supplyAsync(() -> analyzeRegion(subjectId, photograph, region, instruction), executor)
                    .orTimeout(properties.getRegionTimeoutMs(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        discard(subjectId, region, reasonFor(ex));
                        return null;
                    });
            futures.add(f);
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<Ballot> ballots = new ArrayList<>();
        for (CompletableFuture<RegionVerdict> f : futures) {
            RegionVerdict v = f.join();
            if (v != null) {
                ballots.add(new Ballot(v.material(), v.type(), v.confidence(), v.confidence()));
            }
        }

        double weight = ensemble.weightFor(SourceKind.AGGREGATOR);
        if (ballots.isEmpty()) {
            LOG.info("No region survived for subject={}; using fallback pair at {}",
                    subjectId, fallback.getAggregatorConfidence());
            return new Observation(fallback.getMaterial(), fallback.getType(),
                    fallback.getAggregatorConfidence(), SourceKind.AGGREGATOR, weight);
        }

        VoteResult vote = WeightedVoter.vote(ballots);
        LOG.info("Aggregated subject={}: {} / {} ({}) from {}/{} regions in {} ms",
                subjectId, vote.material(), vote.type(), String.format("%.3f", vote.confidence()),
                ballots.size(), futures.size(), TimeUtils.elapsedMillis(t0));
        return new Observation(vote.material(), vote.type(), vote.confidence(), SourceKind.AGGREGATOR, weight);
    }

    private RegionVerdict analyzeRegion(String subjectId, Photograph photograph, AnalysisRegion region,
                                        String instruction) {
        long t0 = System.nanoTime();
        RegionImage image = cropper.crop(photograph.image(), region);
        String reply = oracle.analyze(image, instruction);
        Optional<RegionVerdict> parsed = parser.parse(reply);
        if (parsed.isEmpty()) {
            discard(subjectId, region, REASON_UNPARSEABLE);
            return null;
        }
        RegionVerdict verdict = parsed.get();
        if (verdict.confidence() <= properties.getDiscardThreshold()) {
            LOG.debug("Region {} below threshold: {}", region.regionName(), verdict.confidence());
            discard(subjectId, region, REASON_LOW_CONFIDENCE);
            return null;
        }
        LOG.debug("Region {} -> {} / {} ({}) in {} ms: {}", region.regionName(), verdict.material(),
                verdict.type(), verdict.confidence(), TimeUtils.elapsedMillis(t0),
                LogSanitizer.preview(verdict.rationale(), properties.getRationalePreviewChars()));
        return verdict;
    }

    private void discard(String subjectId, AnalysisRegion region, String reason) {
        if (metrics != null) {
            metrics.incrementRegionFailure(region.regionName(), reason);
        }
        publisher.publishEvent(new RegionAnalysisFailedEvent(subjectId, region.regionName(), reason, Instant.now()));
    }

    private String reasonFor(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return REASON_TIMEOUT;
        }
        if (cause instanceof VisionOracleException voe) {
            LOG.debug("Oracle failed for region {}: {}", voe.getRegion(), voe.getMessage());
            return REASON_ORACLE_ERROR;
        }
        LOG.error("Unexpected error during region analysis", cause);
        return REASON_UNEXPECTED;
    }
}
