package com.finance.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single reported line item of a finance submission")
public class Cell {

    @Schema(description = "Sheet-local cell address", example = "C12")
    private String address;

    @Schema(description = "Sheet-qualified address, the join key across submissions", example = "BalanceSheet!C12")
    private String globalAddress;

    @Schema(description = "Numeric value, absent for text or blank cells", example = "125000.50")
    private Double value;

    @Schema(description = "Raw text value", example = "n/a")
    private String textValue;

    @Schema(description = "Declared data type of the cell", example = "number")
    private CellDataType dataType;

    @Schema(description = "Aggregation of the reported value", example = "monthly")
    private AggregationType aggregation;

    /**
     * Only number-typed cells with a value take part in numeric detection.
     */
    @JsonIgnore
    public boolean isNumeric() {
        return dataType == CellDataType.NUMBER && value != null && !value.isNaN() && !value.isInfinite();
    }

    @JsonIgnore
    public boolean isBlank() {
        if (dataType == CellDataType.NUMBER) {
            return value == null;
        }
        return textValue == null || textValue.isBlank();
    }

    /**
     * Sheet part of the global address ("BalanceSheet" for "BalanceSheet!C12").
     */
    @JsonIgnore
    public String getSheetName() {
        if (globalAddress == null) return "";
        int idx = globalAddress.indexOf('!');
        return idx < 0 ? "" : globalAddress.substring(0, idx);
    }
}
