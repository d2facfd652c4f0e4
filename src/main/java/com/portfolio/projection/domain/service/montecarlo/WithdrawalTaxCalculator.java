package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.AccountType;
import com.portfolio.projection.domain.model.TaxSettings;
import org.springframework.stereotype.Component;

/**
 * Simplified three-bucket withdrawal taxation.
 * <ul>
 *   <li>tax_free: nothing owed</li>
 *   <li>tax_deferred: the whole withdrawal is ordinary income plus state tax</li>
 *   <li>taxable: only the gains share of the withdrawal is taxed, at capital gains plus state rate</li>
 * </ul>
 */
@Component
public class WithdrawalTaxCalculator {

    public double tax(double grossWithdrawal, double portfolioValue, double costBasis, TaxSettings settings) {
        AccountType accountType = settings.effectiveAccountType();
        return switch (accountType) {
            case TAX_FREE -> 0.0;
            case TAX_DEFERRED -> grossWithdrawal * settings.combinedOrdinaryRate();
            case TAXABLE -> taxableAccountTax(grossWithdrawal, portfolioValue, costBasis, settings);
        };
    }

    /**
     * Gross amount to take out so that {@code desiredNet} remains after tax. Only tax_deferred
     * withdrawals are grossed up; the other account types withdraw the net amount as is.
     */
    public double grossUp(double desiredNet, TaxSettings settings) {
        if (settings.effectiveAccountType() != AccountType.TAX_DEFERRED) {
            return desiredNet;
        }
        double rate = settings.combinedOrdinaryRate();
        if (rate >= 1.0) {
            throw new IllegalStateException("combined ordinary and state rate must be below 1, got " + rate);
        }
        return desiredNet / (1.0 - rate);
    }

    private double taxableAccountTax(double grossWithdrawal, double portfolioValue,
                                     double costBasis, TaxSettings settings) {
        if (portfolioValue <= costBasis) return 0.0;

        double gainsProportion = (portfolioValue - costBasis) / portfolioValue;
        double taxableAmount = grossWithdrawal * gainsProportion;
        return taxableAmount * settings.combinedCapitalGainsRate();
    }
}
