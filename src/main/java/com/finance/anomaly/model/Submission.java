package com.finance.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A dealer's finance submission for one reporting month")
public class Submission {

    /**
     * Chronological order: reporting period first, then filing time, then id.
     */
    public static final Comparator<Submission> CHRONOLOGICAL = Comparator
            .comparingInt(Submission::getYear)
            .thenComparingInt(Submission::getMonth)
            .thenComparing(Submission::getSubmittedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Submission::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    @Schema(description = "Submission identifier", example = "SUB-000123")
    private String id;

    @Schema(description = "Submitting dealer", example = "DEALER-001")
    private String dealerId;

    @Schema(description = "Template the submission was filled from", example = "TPL-2024")
    private String templateId;

    @Schema(description = "Reporting month (1-12)", example = "3")
    private int month;

    @Schema(description = "Reporting year", example = "2024")
    private int year;

    @Schema(description = "When the submission was filed")
    private Instant submittedAt;

    @Schema(description = "Workflow status", example = "SUBMITTED")
    private String status;

    @Builder.Default
    @Schema(description = "Reported cells")
    private List<Cell> cells = new ArrayList<>();

    @JsonIgnore
    public YearMonth getPeriod() {
        return YearMonth.of(year, month);
    }

    /**
     * First cell reported under the given global address.
     */
    public Optional<Cell> findCell(String globalAddress) {
        if (cells == null || globalAddress == null) return Optional.empty();
        for (Cell cell : cells) {
            if (globalAddress.equals(cell.getGlobalAddress())) {
                return Optional.of(cell);
            }
        }
        return Optional.empty();
    }

    /**
     * Numeric value per global address, in reporting order. Duplicated addresses keep the first value.
     */
    @JsonIgnore
    public Map<String, Double> getNumericValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        if (cells == null) return values;
        for (Cell cell : cells) {
            if (cell.isNumeric() && cell.getGlobalAddress() != null) {
                values.putIfAbsent(cell.getGlobalAddress(), cell.getValue());
            }
        }
        return values;
    }
}
