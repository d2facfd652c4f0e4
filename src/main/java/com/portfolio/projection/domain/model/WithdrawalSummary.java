package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Per-path withdrawal totals averaged over the batch.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WithdrawalSummary {

    private double meanGrossWithdrawn;
    private double meanTaxPaid;
    private double meanNetWithdrawn;
    private int depletedPathCount;
    private Integer earliestDepletionYear;
}
