package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.AccountType;
import com.portfolio.projection.domain.model.AssetClass;
import com.portfolio.projection.domain.model.SimulationRequest;
import com.portfolio.projection.domain.model.TaxSettings;
import com.portfolio.projection.domain.service.montecarlo.SimulationError.Kind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks a request before any path is simulated. The first failing rule is reported.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private final SimulationProperties properties;

    public Optional<SimulationError> validate(SimulationRequest request) {
        if (request == null || request.getAssetClasses() == null || request.getAssetClasses().isEmpty()) {
            return fail(Kind.NO_ASSET_CLASSES, "At least one asset class is required");
        }

        for (AssetClass asset : request.getAssetClasses()) {
            Optional<SimulationError> invalid = validateAsset(asset);
            if (invalid.isPresent()) return invalid;
        }

        double total = request.totalAllocation();
        if (Math.abs(total - 1.0) > properties.getAllocationTolerance()) {
            return fail(Kind.ALLOCATION_SUM_MISMATCH, String.format(
                    "Asset allocations must sum to 100%% (got %.2f%%)", total * 100));
        }

        if (request.getNumSimulations() < properties.getMinSimulations()) {
            return fail(Kind.TOO_FEW_SIMULATIONS, String.format(
                    "Minimum %,d simulations required", properties.getMinSimulations()));
        }
        if (request.getTimeHorizon() > properties.getMaxTimeHorizon()) {
            return fail(Kind.TIME_HORIZON_TOO_LONG,
                    "Maximum time horizon is " + properties.getMaxTimeHorizon() + " years");
        }
        if (request.getTimeHorizon() < properties.getMinTimeHorizon()) {
            return fail(Kind.TIME_HORIZON_TOO_SHORT,
                    "Minimum time horizon is " + properties.getMinTimeHorizon() + " year");
        }

        if (!(request.getInitialInvestment() > 0) || Double.isInfinite(request.getInitialInvestment())) {
            return fail(Kind.INVALID_INITIAL_INVESTMENT, "Initial investment must be positive");
        }
        if (request.getAnnualDrawdown() < 0 || Double.isNaN(request.getAnnualDrawdown())) {
            return fail(Kind.NEGATIVE_DRAWDOWN, "Annual drawdown cannot be negative");
        }
        if (!(request.getInflationRate() >= -1.0) || Double.isInfinite(request.getInflationRate())) {
            return fail(Kind.INVALID_INFLATION_RATE, "Inflation rate cannot be below -100%");
        }

        return validateTax(request);
    }

    private Optional<SimulationError> validateAsset(AssetClass asset) {
        if (asset == null) {
            return fail(Kind.INVALID_ASSET_CLASS, "Asset class entries cannot be null");
        }
        String name = asset.getName() == null ? "unnamed" : asset.getName();
        if (asset.getStdDeviation() < 0) {
            return fail(Kind.INVALID_ASSET_CLASS, name + ": standard deviation cannot be negative");
        }
        if (asset.getMinReturn() > asset.getMaxReturn()) {
            return fail(Kind.INVALID_ASSET_CLASS, name + ": minimum return exceeds maximum return");
        }
        if (asset.getMinReturn() < -1.0) {
            return fail(Kind.INVALID_ASSET_CLASS, name + ": minimum return cannot be below -100%");
        }
        if (asset.getAllocation() < 0 || asset.getAllocation() > 1.0) {
            return fail(Kind.INVALID_ASSET_CLASS, name + ": allocation must be between 0% and 100%");
        }
        return Optional.empty();
    }

    private Optional<SimulationError> validateTax(SimulationRequest request) {
        TaxSettings tax = request.effectiveTaxSettings();
        if (tax.getCapitalGainsTaxRate() < 0 || tax.getOrdinaryIncomeTaxRate() < 0 || tax.getStateTaxRate() < 0) {
            return fail(Kind.NEGATIVE_TAX_RATE, "Tax rates cannot be negative");
        }

        boolean grossedUp = request.withdrawsEachYear()
                && tax.effectiveAccountType() == AccountType.TAX_DEFERRED;
        if (grossedUp && tax.combinedOrdinaryRate() >= 1.0) {
            return fail(Kind.TAX_DEFERRED_RATE_TOO_HIGH, String.format(
                    "Combined ordinary income and state tax rate must be below 100%% for tax-deferred withdrawals (got %.2f%%)",
                    tax.combinedOrdinaryRate() * 100));
        }
        return Optional.empty();
    }

    private Optional<SimulationError> fail(Kind kind, String message) {
        return Optional.of(SimulationError.of(kind, message));
    }
}
