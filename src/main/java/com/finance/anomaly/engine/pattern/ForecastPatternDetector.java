package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.engine.timeseries.ScopedSeries;
import com.finance.anomaly.engine.timeseries.SeriesExtractor;
import com.finance.anomaly.engine.timeseries.SeriesForecaster;
import com.finance.anomaly.engine.timeseries.SeriesPoint;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Short-horizon forecast of each cell of a dealer's history up to the submission.
 *
 * Logic: series with at least 12 points are fitted with a linear trend plus monthly seasonal
 * indices and extrapolated 3 months ahead. The pattern reports the change from the last reported
 * value to the first forecast month (high above 20%) with confidence R^2 * 100.
 */
@Component
public class ForecastPatternDetector implements Detector<DataPattern> {

    private static final Logger log = LoggerFactory.getLogger(ForecastPatternDetector.class);

    private final DetectionThresholdConfig config;

    public ForecastPatternDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "ml-forecast";
    }

    @Override
    public DetectionOutcome<DataPattern> detect(DetectionContext context) {
        DetectionThresholdConfig.Forecast options = config.getForecast();
        Map<String, List<SeriesPoint>> series = ScopedSeries.of(context);
        SeriesForecaster forecaster = new SeriesForecaster(options.getSeasonLength());

        List<DataPattern> patterns = new ArrayList<>();
        int analysed = 0;
        for (Map.Entry<String, List<SeriesPoint>> entry : series.entrySet()) {
            if (context.isCancelled()) break;
            List<SeriesPoint> points = entry.getValue();
            if (points.size() < options.getMinPoints()) continue;
            analysed++;

            try {
                SeriesForecaster.Forecast forecast = forecaster.forecast(SeriesExtractor.values(points), options.getHorizon());
                SeriesPoint last = points.get(points.size() - 1);
                if (last.getValue() == 0.0) continue;

                double change = DescriptiveStatistics.percentChange(last.getValue(), forecast.getValues()[0]);
                YearMonth firstMonth = last.getPeriod().plusMonths(1);
                YearMonth lastMonth = last.getPeriod().plusMonths(options.getHorizon());
                String values = Arrays.stream(forecast.getValues())
                        .mapToObj(v -> String.format(Locale.ROOT, "%.0f", v))
                        .collect(Collectors.joining(", "));

                patterns.add(DataPattern.builder()
                        .patternType("Forecast Trend")
                        .description(String.format(Locale.ROOT,
                                "Cell %s is forecast at %s for %s to %s, a %.1f%% change from the last reported value %.0f",
                                entry.getKey(), values, ReportingPeriods.label(firstMonth),
                                ReportingPeriods.label(lastMonth), change, last.getValue()))
                        .significance(Math.abs(change) > options.getHighPercent() ? Severity.HIGH : Severity.MEDIUM)
                        .confidenceScore(forecast.getR2() * 100.0)
                        .detectedAt(context.getNow())
                        .r2Value(forecast.getR2())
                        .formula(String.format(Locale.ROOT, "trend %+.2f per month%s", forecast.getSlope(),
                                forecast.isSeasonal() ? " + monthly seasonal index" : ""))
                        .relatedCellAddresses(List.of(entry.getKey()))
                        .timeRange(TimeRange.of(firstMonth, lastMonth))
                        .build());
            } catch (RuntimeException e) {
                log.warn("Forecast failed for {} in {} {}: {}", entry.getKey(), context.getScope(),
                        context.subjectLabel(), e.getMessage());
            }
        }

        if (analysed == 0 && !context.isCancelled()) {
            return DetectionOutcome.insufficientData(getName(),
                    "no series with at least " + options.getMinPoints() + " points");
        }
        return DetectionOutcome.of(getName(), patterns, context);
    }
}
