package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Submission;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Windows over one dealer's submissions, all deduplicated to one submission per reporting month.
 */
final class DealerHistory {

    private DealerHistory() {}

    /**
     * The dealer's other submissions up to the current one's reporting month, excluding that month.
     */
    static List<Submission> before(DetectionContext context, Submission current) {
        List<Submission> others = context.getSnapshot().submissionsOf(current.getDealerId()).stream()
                .filter(s -> !s.getId().equals(current.getId()))
                .filter(s -> s.getPeriod().isBefore(current.getPeriod()))
                .collect(Collectors.toList());
        return DataSnapshot.firstPerDealerAndPeriod(others);
    }

    /**
     * The dealer's most recent {@code limit} reporting months, oldest first.
     */
    static List<Submission> latest(DetectionContext context, String dealerId, int limit) {
        List<Submission> all = DataSnapshot.firstPerDealerAndPeriod(context.getSnapshot().submissionsOf(dealerId));
        return lastN(all, limit);
    }

    static List<Submission> lastN(List<Submission> chronological, int limit) {
        if (chronological.size() <= limit) return chronological;
        return new ArrayList<>(chronological.subList(chronological.size() - limit, chronological.size()));
    }
}
