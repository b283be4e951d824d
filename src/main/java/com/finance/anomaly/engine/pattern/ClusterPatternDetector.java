package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.timeseries.FeatureMatrix;
import com.finance.anomaly.engine.timeseries.KMeansClusterer;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Groups submissions with similar figures using k-means over a normalized feature matrix.
 *
 * Logic: the feature columns are the addresses present in at least a third of the submissions
 * (max 50). k = clamp(round(sqrt(n / 2)), 2, 10). Every cluster with at least 3 members becomes a
 * Cluster Pattern describing its share of submissions and its three largest average figures
 * (high above 70%, medium above 40%). A cluster whose members span more than one year is also
 * reported as a Stable Pattern.
 *
 * Which submissions are clustered depends on the scope: the dealer's history for submission and
 * dealer scope, the group's latest 200 submissions for group scope, the whole window for global.
 */
@Component
public class ClusterPatternDetector implements Detector<DataPattern> {

    private static final Logger log = LoggerFactory.getLogger(ClusterPatternDetector.class);

    private static final double CLUSTER_CONFIDENCE = 85.0;
    private static final double STABLE_CONFIDENCE = 90.0;

    private final DetectionThresholdConfig config;

    public ClusterPatternDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "ml-cluster";
    }

    @Override
    public DetectionOutcome<DataPattern> detect(DetectionContext context) {
        DetectionThresholdConfig.Clustering options = config.getClustering();
        List<Submission> submissions = submissionsFor(context);
        if (submissions.size() < options.getMinSubmissions()) {
            return DetectionOutcome.insufficientData(getName(),
                    submissions.size() + " submissions, need " + options.getMinSubmissions());
        }

        FeatureMatrix matrix = FeatureMatrix.build(submissions, options.getAddressPresenceRatio(), options.getMaxFeatures());
        if (matrix.featureCount() < options.getMinFeatures()) {
            return DetectionOutcome.insufficientData(getName(),
                    matrix.featureCount() + " common addresses, need " + options.getMinFeatures());
        }

        int n = submissions.size();
        int k = (int) Math.round(Math.sqrt(n / 2.0));
        k = Math.max(options.getMinClusters(), Math.min(options.getMaxClusters(), k));
        KMeansClusterer.Result result = new KMeansClusterer(options.getMaxIterations(), options.getSeed())
                .cluster(matrix.normalized(), k);
        log.debug("Clustered {} submissions into {} clusters for {} {}", n, result.clusterCount(),
                context.getScope(), context.subjectLabel());

        String subject = subjectName(context);
        String qualifier = typeQualifier(context);
        List<String> columns = matrix.getColumns();

        List<DataPattern> patterns = new ArrayList<>();
        for (int cluster = 0; cluster < result.clusterCount(); cluster++) {
            if (context.isCancelled()) break;
            final int id = cluster;
            List<Integer> members = IntStream.range(0, n)
                    .filter(i -> result.getAssignments()[i] == id)
                    .boxed()
                    .collect(Collectors.toList());
            if (members.size() < options.getMinClusterSize()) continue;

            double share = members.size() * 100.0 / n;
            double[] means = matrix.columnMeans(members);
            String characteristics = IntStream.range(0, columns.size()).boxed()
                    .sorted(Comparator.comparingDouble((Integer c) -> -means[c]))
                    .limit(3)
                    .map(c -> String.format(Locale.ROOT, "%s: %.0f", columns.get(c), means[c]))
                    .collect(Collectors.joining(", "));
            List<Submission> clusterSubmissions = members.stream().map(submissions::get).collect(Collectors.toList());

            patterns.add(DataPattern.builder()
                    .patternType(qualifier + "Cluster Pattern")
                    .description(String.format(Locale.ROOT,
                            "%s shows a pattern where %.1f%% of submissions (%d out of %d) share characteristics: %s",
                            subject, share, members.size(), n, characteristics))
                    .significance(share > 70.0 ? Severity.HIGH : share > 40.0 ? Severity.MEDIUM : Severity.LOW)
                    .confidenceScore(CLUSTER_CONFIDENCE)
                    .detectedAt(context.getNow())
                    .relatedCellAddresses(List.copyOf(columns.subList(0, Math.min(5, columns.size()))))
                    .timeRange(ReportingPeriods.span(clusterSubmissions))
                    .build());

            TreeSet<Integer> years = clusterSubmissions.stream()
                    .map(Submission::getYear)
                    .collect(Collectors.toCollection(TreeSet::new));
            if (years.size() > 1) {
                patterns.add(DataPattern.builder()
                        .patternType(qualifier + "Stable Pattern")
                        .description(subject + " shows a stable pattern from " + years.first() + " to " + years.last()
                                + " with consistent financial characteristics")
                        .significance(Severity.HIGH)
                        .confidenceScore(STABLE_CONFIDENCE)
                        .detectedAt(context.getNow())
                        .relatedCellAddresses(List.copyOf(columns.subList(0, Math.min(3, columns.size()))))
                        .timeRange(ReportingPeriods.span(clusterSubmissions))
                        .build());
            }
        }
        return DetectionOutcome.of(getName(), patterns, context);
    }

    private List<Submission> submissionsFor(DetectionContext context) {
        switch (context.getScope()) {
            case SUBMISSION: {
                Submission current = context.getSubmission();
                if (current == null) return List.of();
                List<Submission> history = context.getSnapshot().submissionsOf(current.getDealerId()).stream()
                        .filter(s -> !s.getPeriod().isAfter(current.getPeriod()))
                        .collect(Collectors.toList());
                return DataSnapshot.firstPerDealerAndPeriod(history);
            }
            case DEALER:
                if (context.getDealer() == null) return List.of();
                return DataSnapshot.firstPerDealerAndPeriod(context.getSnapshot().submissionsOf(context.getDealer().getId()));
            case GROUP: {
                List<Submission> group = new ArrayList<>(DataSnapshot.firstPerDealerAndPeriod(
                        context.getSubmissions() != null ? context.getSubmissions() : List.of()));
                group.sort(Submission.CHRONOLOGICAL);
                return DealerHistory.lastN(group, config.getClustering().getMaxGroupSubmissions());
            }
            default:
                return DataSnapshot.firstPerDealerAndPeriod(
                        context.getSubmissions() != null ? context.getSubmissions() : List.of());
        }
    }

    private static String subjectName(DetectionContext context) {
        switch (context.getScope()) {
            case SUBMISSION: {
                String dealerId = context.getSubmission().getDealerId();
                return "Dealer " + context.getSnapshot().dealerName(dealerId);
            }
            case DEALER:
                return "Dealer " + context.getDealer().getName();
            case GROUP: {
                String groupName = context.getSnapshot().getDealers().stream()
                        .filter(d -> context.getGroupId().equals(d.getGroupId()) && d.getGroupName() != null)
                        .map(d -> d.getGroupName())
                        .findFirst()
                        .orElse(context.getGroupId());
                return "Dealer group " + groupName;
            }
            default:
                return "Dealer population";
        }
    }

    private static String typeQualifier(DetectionContext context) {
        switch (context.getScope()) {
            case DEALER:
                return "Dealer " + context.getDealer().getId() + " ";
            case GROUP:
                return "Group " + context.getGroupId() + " ";
            case GLOBAL:
                return "Global ";
            default:
                return "";
        }
    }
}
