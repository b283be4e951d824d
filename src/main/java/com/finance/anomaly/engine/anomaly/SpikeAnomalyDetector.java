package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.timeseries.SeriesSignal;
import com.finance.anomaly.engine.timeseries.SpikeDetector;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Isolated spikes in per-address series, scored by spectral-residual saliency.
 */
@Component
public class SpikeAnomalyDetector extends SeriesAnomalyDetector {

    public SpikeAnomalyDetector(DetectionThresholdConfig config) {
        super(config);
    }

    @Override
    public String getName() {
        return "ml-spike";
    }

    @Override
    protected String kind() {
        return "Spike";
    }

    @Override
    protected String positionPhrase() {
        return "at";
    }

    @Override
    protected List<SeriesSignal> signals(double[] values) {
        DetectionThresholdConfig.TimeSeries options = config.getTimeSeries();
        return new SpikeDetector(options.getSpikeThreshold(), options.getMinSeriesLength(),
                options.getSpikeMinDeviationSigma()).detect(values);
    }
}
