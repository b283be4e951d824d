package com.finance.anomaly.engine.aggregation;

import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fan-in point of a scope: merges the findings of all detector outcomes, drops duplicates and ranks
 * what is left.
 *
 * Two findings are duplicates when type, affected entity, affected metric, related addresses and
 * description all match; the first one wins.
 */
@Component
public class ResultAggregator {

    // Severity rank: high first
    private static final Comparator<Severity> SEVERITY_DESC = Comparator
            .comparingInt((Severity s) -> s == null ? 0 : s.ordinal() + 1)
            .reversed();

    private static final Comparator<Instant> NEWEST_FIRST = Comparator.nullsLast(Comparator.<Instant>reverseOrder());

    static final Comparator<DataAnomaly> ANOMALY_ORDER = Comparator
            .comparing(DataAnomaly::getSeverity, SEVERITY_DESC)
            .thenComparing((DataAnomaly a) -> a.getAnomalyScore() == null ? Double.NEGATIVE_INFINITY : a.getAnomalyScore(),
                    Comparator.<Double>reverseOrder())
            .thenComparing(DataAnomaly::getDetectedAt, NEWEST_FIRST);

    static final Comparator<DataAnomaly> GLOBAL_ANOMALY_ORDER = Comparator
            .comparing(DataAnomaly::getDetectedAt, NEWEST_FIRST)
            .thenComparing(DataAnomaly::getSeverity, SEVERITY_DESC);

    static final Comparator<DataPattern> PATTERN_ORDER = Comparator
            .comparing(DataPattern::getSignificance, SEVERITY_DESC)
            .thenComparing(DataPattern::getConfidenceScore, Comparator.<Double>reverseOrder());

    public List<DataAnomaly> mergeAnomalies(List<DetectionOutcome<DataAnomaly>> outcomes) {
        return merge(outcomes, ResultAggregator::anomalyKey, ANOMALY_ORDER);
    }

    /**
     * Global scope ranks by detection time first, newest on top.
     */
    public List<DataAnomaly> mergeGlobalAnomalies(List<DetectionOutcome<DataAnomaly>> outcomes) {
        return merge(outcomes, ResultAggregator::anomalyKey, GLOBAL_ANOMALY_ORDER);
    }

    public List<DataPattern> mergePatterns(List<DetectionOutcome<DataPattern>> outcomes) {
        return merge(outcomes, ResultAggregator::patternKey, PATTERN_ORDER);
    }

    private static <T> List<T> merge(List<DetectionOutcome<T>> outcomes,
                                     Function<T, List<Object>> key,
                                     Comparator<T> order) {
        Map<List<Object>, T> unique = new LinkedHashMap<>();
        for (DetectionOutcome<T> outcome : outcomes) {
            for (T finding : outcome.getFindings()) {
                unique.putIfAbsent(key.apply(finding), finding);
            }
        }
        List<T> merged = new ArrayList<>(unique.values());
        merged.sort(order);
        return merged;
    }

    private static List<Object> anomalyKey(DataAnomaly anomaly) {
        return keyOf(anomaly.getAnomalyType(), anomaly.getAffectedEntity(), anomaly.getAffectedMetric(),
                anomaly.getRelatedCellAddresses(), anomaly.getDescription());
    }

    private static List<Object> patternKey(DataPattern pattern) {
        return keyOf(pattern.getPatternType(), null, null, pattern.getRelatedCellAddresses(), pattern.getDescription());
    }

    private static List<Object> keyOf(Object... parts) {
        List<Object> key = new ArrayList<>(parts.length);
        for (Object part : parts) {
            key.add(Objects.requireNonNullElse(part, ""));
        }
        return key;
    }
}
