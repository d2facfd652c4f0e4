package com.portfolio.projection.domain.service.defaults;

import com.portfolio.projection.domain.model.AccountType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "portfolio.defaults")
public class PortfolioDefaultsProperties {

    private double initialInvestment = 5_000_000;
    private int timeHorizon = 10;
    private int numSimulations = 10_000;
    private double annualDrawdown = 300_000;
    private double inflationRate = 0.03;
    private Tax tax = new Tax();
    private List<AssetClassEntry> assetClasses = new ArrayList<>(List.of(
            new AssetClassEntry("Stocks", 0.08, 0.15, -0.40, 0.35, 0.30),
            new AssetClassEntry("Bonds", 0.04, 0.08, -0.10, 0.15, 0.30),
            new AssetClassEntry("Alternatives", 0.10, 0.20, -0.30, 0.50, 0.20),
            new AssetClassEntry("Private Credit", 0.07, 0.12, -0.15, 0.25, 0.20)
    ));

    @Getter
    @Setter
    public static class Tax {
        private AccountType accountType = AccountType.TAXABLE;
        private double capitalGainsTaxRate = 0.15;
        private double ordinaryIncomeTaxRate = 0.22;
        private double stateTaxRate = 0.0;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AssetClassEntry {
        private String name;
        private double medianReturn;
        private double stdDeviation;
        private double minReturn;
        private double maxReturn;
        private double allocation;
    }
}
