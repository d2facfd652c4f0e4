package com.portfolio.projection.domain.service.defaults;

import com.portfolio.projection.domain.model.AccountType;
import com.portfolio.projection.domain.model.AssetClass;
import com.portfolio.projection.domain.model.DefaultPortfolio;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DefaultAssetCatalogTest {

    @Test
    @DisplayName("built-in defaults describe a fully allocated four-asset portfolio")
    void builtInDefaults() {
        DefaultPortfolio defaults = new DefaultAssetCatalog(new PortfolioDefaultsProperties()).getDefaults();

        assertThat(defaults.getAssetClasses())
                .extracting(AssetClass::getName)
                .containsExactly("Stocks", "Bonds", "Alternatives", "Private Credit");
        assertThat(defaults.getAssetClasses().stream().mapToDouble(AssetClass::getAllocation).sum())
                .isCloseTo(1.0, within(1e-9));
        assertThat(defaults.getDefaultInitialInvestment()).isEqualTo(5_000_000);
        assertThat(defaults.getDefaultTimeHorizon()).isEqualTo(10);
        assertThat(defaults.getDefaultNumSimulations()).isEqualTo(10_000);
        assertThat(defaults.getDefaultTaxSettings().getAccountType()).isEqualTo(AccountType.TAXABLE);
    }

    @Test
    @DisplayName("configured asset classes replace the built-in list")
    void configuredAssets() {
        PortfolioDefaultsProperties properties = new PortfolioDefaultsProperties();
        properties.setAssetClasses(List.of(
                new PortfolioDefaultsProperties.AssetClassEntry("Gold", 0.05, 0.18, -0.3, 0.4, 1.0)));

        List<AssetClass> assets = new DefaultAssetCatalog(properties).getDefaultAssetClasses();

        assertThat(assets).hasSize(1);
        assertThat(assets.get(0).getName()).isEqualTo("Gold");
        assertThat(assets.get(0).getStdDeviation()).isEqualTo(0.18);
    }
}
