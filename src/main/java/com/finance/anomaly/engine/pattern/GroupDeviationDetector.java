package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.IndustryComparison;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * How a dealer's figures compare with the other dealers of its group.
 *
 * Logic: the dealer's last 12 reporting months (at least 3) are averaged per address and compared
 * with the average of the latest 60 submissions of its peers (at least 10). Only addresses the
 * peers reported at least 10 times count, and at least 3 must be shared. Addresses differing by
 * 20% or more are ranked; the top 3 form one Group Deviation Pattern, high if any differs by 40%
 * or more. The largest deviation is attached as the pattern's industry comparison.
 */
@Component
public class GroupDeviationDetector implements Detector<DataPattern> {

    private static final double CONFIDENCE = 75.0;

    private final DetectionThresholdConfig config;

    public GroupDeviationDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "group-deviation";
    }

    @Override
    public DetectionOutcome<DataPattern> detect(DetectionContext context) {
        DetectionThresholdConfig.DealerPatterns options = config.getDealerPatterns();
        Dealer dealer = context.getDealer();
        if (dealer == null || dealer.getGroupId() == null) {
            return DetectionOutcome.insufficientData(getName(), "dealer belongs to no group");
        }

        List<Submission> own = DealerHistory.latest(context, dealer.getId(), options.getGroupDealerWindow());
        List<Submission> peerSubmissions = new ArrayList<>();
        for (Dealer peer : context.getSnapshot().getDealers()) {
            if (!peer.getId().equals(dealer.getId()) && dealer.getGroupId().equals(peer.getGroupId())) {
                peerSubmissions.addAll(context.getSnapshot().submissionsOf(peer.getId()));
            }
        }
        peerSubmissions = DataSnapshot.firstPerDealerAndPeriod(peerSubmissions);
        peerSubmissions.sort(Submission.CHRONOLOGICAL);
        peerSubmissions = DealerHistory.lastN(peerSubmissions, options.getGroupPeerWindow());

        if (own.size() < options.getGroupMinDealerSubmissions() || peerSubmissions.size() < options.getGroupMinPeerSubmissions()) {
            return DetectionOutcome.insufficientData(getName(), own.size() + " dealer and "
                    + peerSubmissions.size() + " peer submissions");
        }

        Map<String, List<Double>> dealerValues = collect(own);
        Map<String, List<Double>> peerValues = collect(peerSubmissions);
        List<String> common = dealerValues.keySet().stream()
                .filter(a -> peerValues.containsKey(a) && peerValues.get(a).size() >= options.getGroupMinAddressOccurrences())
                .collect(Collectors.toList());
        if (common.size() < options.getGroupMinCommonAddresses()) {
            return DetectionOutcome.insufficientData(getName(),
                    common.size() + " addresses shared with the group, need " + options.getGroupMinCommonAddresses());
        }

        List<Deviation> deviations = new ArrayList<>();
        for (String address : common) {
            double dealerAvg = DescriptiveStatistics.mean(dealerValues.get(address));
            double groupAvg = DescriptiveStatistics.mean(peerValues.get(address));
            if (groupAvg == 0.0) continue;
            double percent = DescriptiveStatistics.percentChange(groupAvg, dealerAvg);
            if (Math.abs(percent) >= options.getGroupDeviationPercent()) {
                deviations.add(new Deviation(address, dealerAvg, groupAvg, percent));
            }
        }
        if (deviations.isEmpty()) {
            return DetectionOutcome.completed(getName(), List.of());
        }

        List<Deviation> top = deviations.stream()
                .sorted(Comparator.comparingDouble((Deviation d) -> -Math.abs(d.percent)))
                .limit(options.getTopChanges())
                .collect(Collectors.toList());

        String direction = top.stream().allMatch(d -> d.percent > 0) ? "higher"
                : top.stream().allMatch(d -> d.percent < 0) ? "lower"
                : "different";
        String summary = top.stream()
                .map(d -> String.format(Locale.ROOT, "%s: %.1f%% different (%.0f vs. group avg %.0f)",
                        d.address, d.percent, d.dealerAverage, d.groupAverage))
                .collect(Collectors.joining(", "));
        boolean high = top.stream().anyMatch(d -> Math.abs(d.percent) >= options.getGroupHighPercent());
        String groupName = dealer.getGroupName() != null ? dealer.getGroupName() : dealer.getGroupId();

        DataPattern pattern = DataPattern.builder()
                .patternType("Group Deviation Pattern")
                .description("Dealer " + dealer.getName() + " shows " + direction + " values than other "
                        + groupName + " dealers: " + summary)
                .significance(high ? Severity.HIGH : Severity.MEDIUM)
                .confidenceScore(CONFIDENCE)
                .detectedAt(context.getNow())
                .relatedCellAddresses(top.stream().map(d -> d.address).collect(Collectors.toList()))
                .timeRange(ReportingPeriods.span(own))
                .industryComparison(IndustryComparison.builder()
                        .benchmark(top.get(0).groupAverage)
                        .deviation(DescriptiveStatistics.round1(top.get(0).percent))
                        .build())
                .build();
        return DetectionOutcome.of(getName(), List.of(pattern), context);
    }

    private static Map<String, List<Double>> collect(List<Submission> submissions) {
        Map<String, List<Double>> values = new LinkedHashMap<>();
        for (Submission submission : submissions) {
            submission.getNumericValues().forEach((address, value) ->
                    values.computeIfAbsent(address, k -> new ArrayList<>()).add(value));
        }
        return values;
    }

    private static final class Deviation {
        final String address;
        final double dealerAverage;
        final double groupAverage;
        final double percent;

        Deviation(String address, double dealerAverage, double groupAverage, double percent) {
            this.address = address;
            this.dealerAverage = dealerAverage;
            this.groupAverage = groupAverage;
            this.percent = percent;
        }
    }
}
