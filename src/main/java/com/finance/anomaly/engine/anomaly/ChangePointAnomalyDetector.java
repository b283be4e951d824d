package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.timeseries.ChangePointDetector;
import com.finance.anomaly.engine.timeseries.SeriesSignal;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sustained level shifts in per-address series. The reported period is the first month after the shift.
 */
@Component
public class ChangePointAnomalyDetector extends SeriesAnomalyDetector {

    public ChangePointAnomalyDetector(DetectionThresholdConfig config) {
        super(config);
    }

    @Override
    public String getName() {
        return "ml-change-point";
    }

    @Override
    protected String kind() {
        return "Change Point";
    }

    @Override
    protected String positionPhrase() {
        return "starting at";
    }

    @Override
    protected List<SeriesSignal> signals(double[] values) {
        DetectionThresholdConfig.TimeSeries options = config.getTimeSeries();
        return new ChangePointDetector(options.getChangePointConfidence(), options.getMinSeriesLength()).detect(values);
    }
}
