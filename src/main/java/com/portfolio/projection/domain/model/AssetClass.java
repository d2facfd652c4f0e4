package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One asset class of a portfolio. All figures are decimal fractions (0.08 = 8%).
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetClass {

    private String name;
    private double medianReturn;
    private double stdDeviation;
    private double minReturn;
    private double maxReturn;
    private double allocation;
}
