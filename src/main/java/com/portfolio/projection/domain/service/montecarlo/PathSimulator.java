package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.AssetClass;
import com.portfolio.projection.domain.model.SimulationPath;
import com.portfolio.projection.domain.model.SimulationRequest;
import com.portfolio.projection.domain.model.TaxSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Runs one path year by year. Each year of an active path: withdraw (grossed up for
 * tax_deferred), tax the withdrawal against the pre-withdrawal value, reduce the value and the
 * cost basis, then either deplete or grow by the allocation-weighted sampled return.
 * A depleted path stays at zero through the horizon and draws no further returns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PathSimulator {

    private final ReturnSampler returnSampler;
    private final WithdrawalTaxCalculator taxCalculator;

    public SimulationPath simulate(SimulationRequest request, RandomGenerator rng) {
        int horizon = request.getTimeHorizon();
        List<AssetClass> assets = request.getAssetClasses();
        TaxSettings tax = request.effectiveTaxSettings();
        boolean taxable = tax.effectiveAccountType().isTaxable();
        boolean withdrawing = request.withdrawsEachYear();

        double[] values = new double[horizon + 1];
        double portfolioValue = request.getInitialInvestment();
        double costBasis = portfolioValue;
        values[0] = portfolioValue;

        double totalGross = 0.0;
        double totalTax = 0.0;
        double totalNet = 0.0;
        Integer depletionYear = null;

        for (int year = 1; year <= horizon; year++) {
            if (withdrawing) {
                double desiredNet = request.getAnnualDrawdown()
                        * Math.pow(1.0 + request.getInflationRate(), year - 1);
                double grossWithdrawal = taxCalculator.grossUp(desiredNet, tax);
                double taxOwed = taxCalculator.tax(grossWithdrawal, portfolioValue, costBasis, tax);

                totalGross += grossWithdrawal;
                totalTax += taxOwed;
                totalNet += grossWithdrawal - taxOwed;

                portfolioValue = Math.max(0.0, portfolioValue - grossWithdrawal);

                if (taxable && portfolioValue > 0) {
                    costBasis *= portfolioValue / (portfolioValue + grossWithdrawal);
                }
            }

            if (portfolioValue <= 0) {
                depletionYear = year;
                break;
            }

            double annualReturn = 0.0;
            for (AssetClass asset : assets) {
                annualReturn += returnSampler.sample(asset, rng) * asset.getAllocation();
            }
            portfolioValue = Math.max(0.0, portfolioValue * (1.0 + annualReturn));
            if (!taxable) {
                costBasis = portfolioValue;
            }
            values[year] = portfolioValue;

            // a return of -100% or worse wipes the path out just like an oversized withdrawal
            if (portfolioValue <= 0) {
                depletionYear = year;
                break;
            }
        }

        if (depletionYear != null) {
            log.trace("[PathSim] depleted: year={}, horizon={}", depletionYear, horizon);
        }

        return new SimulationPath(values, totalGross, totalTax, totalNet, depletionYear);
    }
}
