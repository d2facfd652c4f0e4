package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaxSettings {

    public static final TaxSettings UNTAXED = new TaxSettings(AccountType.TAX_FREE, 0.0, 0.0, 0.0);

    private AccountType accountType;
    private double capitalGainsTaxRate;
    private double ordinaryIncomeTaxRate;
    private double stateTaxRate;

    @JsonIgnore
    public double combinedOrdinaryRate() {
        return ordinaryIncomeTaxRate + stateTaxRate;
    }

    @JsonIgnore
    public double combinedCapitalGainsRate() {
        return capitalGainsTaxRate + stateTaxRate;
    }

    @JsonIgnore
    public AccountType effectiveAccountType() {
        return accountType != null ? accountType : AccountType.TAX_FREE;
    }
}
