package com.finance.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionThresholdConfig {

    // Worker threads for detector fan-out. 0 or less = number of available cores.
    private int parallelism = 0;

    // Deadline for batch scopes (group, global). Units still running when it passes are cancelled.
    private long batchTimeoutSeconds = 30;

    // Default look-back window of the global scope when the caller does not pass one.
    private int defaultLastMonths = 3;

    private Distribution distribution = new Distribution();
    private CrossDealer crossDealer = new CrossDealer();
    private Trend trend = new Trend();
    private SubmissionChecks submission = new SubmissionChecks();
    private DealerChecks dealer = new DealerChecks();
    private Correlation correlation = new Correlation();
    private Arithmetic arithmetic = new Arithmetic();
    private Seasonal seasonal = new Seasonal();
    private DealerPatterns dealerPatterns = new DealerPatterns();
    private TimeSeries timeSeries = new TimeSeries();
    private Clustering clustering = new Clustering();
    private Forecast forecast = new Forecast();

    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Distribution {
        private int minObservations = 5;
        private int histogramBins = 10;
        // Second-highest bin must reach this share of the highest one
        private double bimodalPeakRatio = 0.75;
        private double skewnessThreshold = 1.5;
    }

    @Data
    public static class CrossDealer {
        private int minDealers = 3;
        private double outlierZScore = 2.0;
        // Minimum |value - peerMean| / |peerMean| in percent; ignored when the peer mean is zero
        private double minDeviationPercent = 10.0;
        private double mediumZ = 2.5;
        private double highZ = 3.0;
        private double scorePerZ = 25.0;
    }

    @Data
    public static class Trend {
        private int months = 3;
        private int minSharedAddresses = 3;
        private double highPercent = 30.0;
    }

    @Data
    public static class SubmissionChecks {
        private int missingHighCount = 5;
        // Tables need strictly more numeric cells than this for the outlier check
        private int outlierMinCells = 5;
        private double outlierZ = 2.0;
        private int outlierHighCount = 2;
        private double yearOverYearPercent = 20.0;
        private double yearOverYearHighPercent = 50.0;
        private int missingHistoricalHighCount = 5;
    }

    @Data
    public static class DealerChecks {
        private int minSubmissions = 3;
        private double quarterUpliftRatio = 1.2;
        private int quarterMinSamples = 2;
        private double quarterHighPercent = 40.0;
        private int industryMinPeers = 3;
        private double industryDeviationPercent = 30.0;
        private double industryHighPercent = 50.0;
    }

    @Data
    public static class Correlation {
        private int minHistory = 5;
        private int minAddresses = 2;
        private double threshold = 0.7;
        private double highThreshold = 0.9;
    }

    @Data
    public static class Arithmetic {
        private double tolerance = 0.01;
        private int minCellsPerSheet = 3;
        private double confidence = 95.0;
    }

    @Data
    public static class Seasonal {
        private int minHistory = 11;
        private double minSpreadRatio = 0.20;
        private double highPercent = 50.0;
    }

    @Data
    public static class DealerPatterns {
        private int minSubmissions = 12;
        private int maxSubmissions = 60;

        private double yearlyChangePercent = 15.0;
        private double yearlyHighPercent = 30.0;
        private int topChanges = 3;

        private double monthlyPresenceRatio = 0.8;
        private int monthlyMinAddresses = 3;
        private int monthlyMaxAddresses = 10;
        private int monthlyMinMonths = 6;
        private double monthlyDeviationPercent = 15.0;

        private int groupDealerWindow = 12;
        private int groupPeerWindow = 60;
        private int groupMinDealerSubmissions = 3;
        private int groupMinPeerSubmissions = 10;
        private int groupMinAddressOccurrences = 10;
        private int groupMinCommonAddresses = 3;
        private double groupDeviationPercent = 20.0;
        private double groupHighPercent = 40.0;
    }

    @Data
    public static class TimeSeries {
        private int minPoints = 10;
        private int minSeriesLength = 8;
        private double spikeThreshold = 0.3;
        private double spikeMinDeviationSigma = 3.0;
        private double changePointConfidence = 0.95;
        private double highScore = 0.7;
    }

    @Data
    public static class Clustering {
        private int minSubmissions = 4;
        private double addressPresenceRatio = 1.0 / 3.0;
        private int maxFeatures = 50;
        private int minFeatures = 2;
        private int minClusters = 2;
        private int maxClusters = 10;
        private int minClusterSize = 3;
        private int maxIterations = 100;
        private long seed = 42L;
        private int maxGroupSubmissions = 200;
    }

    @Data
    public static class Forecast {
        private int minPoints = 12;
        private int horizon = 3;
        private int seasonLength = 12;
        private double highPercent = 20.0;
    }
}
