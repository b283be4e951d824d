package com.finance.anomaly.engine;

import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.Submission;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What a detector run sees: the scope's loaded snapshot plus the unit it is focused on.
 * Which of the focus fields are set depends on the scope.
 */
@Value
@Builder(toBuilder = true)
public class DetectionContext {

    DetectionScope scope;

    DataSnapshot snapshot;

    // Submission under analysis (submission scope, or a dealer's latest submission)
    Submission submission;

    // Dealer under analysis (submission and dealer scope, and each dealer of a group fan-out)
    Dealer dealer;

    // Dealer group under analysis (group scope)
    String groupId;

    // Submissions the cross-sectional detectors work on (group or global working set)
    List<Submission> submissions;

    Instant now;

    @Builder.Default
    CancellationToken cancellation = CancellationToken.none();

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Name used for the affected-entity field of findings.
     */
    public String subjectLabel() {
        switch (scope) {
            case SUBMISSION:
                return submission != null ? submission.getId() : null;
            case DEALER:
                return dealer != null ? dealer.getName() : null;
            case GROUP:
                return groupId;
            default:
                return "global";
        }
    }
}
