package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.timeseries.ScopedSeries;
import com.finance.anomaly.engine.timeseries.SeriesExtractor;
import com.finance.anomaly.engine.timeseries.SeriesPoint;
import com.finance.anomaly.engine.timeseries.SeriesSignal;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared driver for the per-address time-series detectors: builds the scope's series, runs the
 * algorithm on each series long enough, and turns every signal into an anomaly. An address whose
 * computation throws is logged and skipped.
 */
public abstract class SeriesAnomalyDetector implements Detector<DataAnomaly> {

    private static final Logger log = LoggerFactory.getLogger(SeriesAnomalyDetector.class);

    protected final DetectionThresholdConfig config;

    protected SeriesAnomalyDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    /**
     * Finding kind used in type tags, e.g. "Spike".
     */
    protected abstract String kind();

    /**
     * Preposition before the period in descriptions ("at", "starting at").
     */
    protected abstract String positionPhrase();

    protected abstract List<SeriesSignal> signals(double[] values);

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        int minPoints = config.getTimeSeries().getMinPoints();
        Map<String, List<SeriesPoint>> series = ScopedSeries.of(context);

        List<DataAnomaly> anomalies = new ArrayList<>();
        int analysed = 0;
        for (Map.Entry<String, List<SeriesPoint>> entry : series.entrySet()) {
            if (context.isCancelled()) break;
            List<SeriesPoint> points = entry.getValue();
            if (points.size() < minPoints) continue;
            analysed++;

            try {
                for (SeriesSignal signal : signals(SeriesExtractor.values(points))) {
                    anomalies.add(toAnomaly(context, entry.getKey(), points, signal));
                }
            } catch (RuntimeException e) {
                log.warn("{} detection failed for {} in {} {}: {}", kind(), entry.getKey(),
                        context.getScope(), context.subjectLabel(), e.getMessage());
            }
        }

        if (analysed == 0 && !context.isCancelled()) {
            return DetectionOutcome.insufficientData(getName(), "no series with at least " + minPoints + " points");
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }

    private DataAnomaly toAnomaly(DetectionContext context, String address, List<SeriesPoint> points,
                                  SeriesSignal signal) {
        SeriesPoint point = points.get(signal.getPosition());
        double expected = signal.getPosition() > 0 ? points.get(signal.getPosition() - 1).getValue() : point.getValue();
        return DataAnomaly.builder()
                .anomalyType("ML-Detected " + ScopedSeries.typeQualifier(context) + kind())
                .description(String.format(Locale.ROOT, "%s detected in %s for %s %s %s with confidence score %.2f",
                        kind(), address, ScopedSeries.subjectPhrase(context), positionPhrase(),
                        ReportingPeriods.label(point.getPeriod()), signal.getScore()))
                .severity(Severity.fromConfidence(signal.getScore(), config.getTimeSeries().getHighScore()))
                .detectedAt(context.getNow())
                .anomalyScore(signal.getScore() * 100.0)
                .affectedEntity(context.subjectLabel())
                .affectedMetric(address)
                .actualValue(point.getValue())
                .expectedValue(expected)
                .relatedCellAddresses(List.of(address))
                .timeRange(TimeRange.single(point.getPeriod()))
                .build();
    }
}
