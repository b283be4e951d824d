package com.finance.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Sheet/table/cell layout of a reporting template. Used for completeness checks
 * and for grouping a submission's cells by table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Layout of a reporting template")
public class TemplateStructure {

    @Schema(description = "Template identifier", example = "TPL-2024")
    private String templateId;

    @Schema(description = "Template name", example = "Dealer Financial Statement 2024")
    private String name;

    @Builder.Default
    private List<Sheet> sheets = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Sheet {
        private String name;

        @Builder.Default
        private List<Table> tables = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Table {
        private String name;

        @Builder.Default
        private List<TemplateCell> cells = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TemplateCell {
        private String address;
        private String globalAddress;
        private CellDataType dataType;
    }
}
