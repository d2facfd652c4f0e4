package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One simulated trajectory. Index {@code y} of the value array is the portfolio value at the
 * end of year {@code y}; index 0 is the initial investment.
 */
@Getter
public class SimulationPath {

    @JsonIgnore
    private final double[] values;
    private final double totalGrossWithdrawn;
    private final double totalTaxPaid;
    private final double totalNetWithdrawn;
    private final Integer depletionYear;

    public SimulationPath(double[] values, double totalGrossWithdrawn, double totalTaxPaid,
                          double totalNetWithdrawn, Integer depletionYear) {
        this.values = values.clone();
        this.totalGrossWithdrawn = totalGrossWithdrawn;
        this.totalTaxPaid = totalTaxPaid;
        this.totalNetWithdrawn = totalNetWithdrawn;
        this.depletionYear = depletionYear;
    }

    public List<PathPoint> getPoints() {
        List<PathPoint> points = new ArrayList<>(values.length);
        for (int year = 0; year < values.length; year++) {
            points.add(new PathPoint(year, values[year]));
        }
        return Collections.unmodifiableList(points);
    }

    public double valueAt(int year) {
        return values[year];
    }

    public double finalValue() {
        return values[values.length - 1];
    }

    public int size() {
        return values.length;
    }

    public boolean isDepleted() {
        return depletionYear != null;
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }
}
