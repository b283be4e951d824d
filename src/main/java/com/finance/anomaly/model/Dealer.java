package com.finance.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A dealer that files periodic finance submissions")
public class Dealer {

    @Schema(description = "Dealer identifier", example = "DEALER-001")
    private String id;

    @Schema(description = "Dealer display name", example = "Northside Motors")
    private String name;

    @Schema(description = "Identifier of the dealer group this dealer belongs to", example = "GROUP-01")
    private String groupId;

    @Schema(description = "Dealer group display name", example = "Metro Auto Group")
    private String groupName;
}
