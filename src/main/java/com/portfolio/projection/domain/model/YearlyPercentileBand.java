package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class YearlyPercentileBand {

    private int year;
    private double percentile5;
    private double percentile25;
    private double median;
    private double percentile75;
    private double percentile95;
}
