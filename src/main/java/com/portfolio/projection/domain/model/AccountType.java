package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AccountType {

    @JsonProperty("taxable")
    TAXABLE,

    @JsonProperty("tax_deferred")
    TAX_DEFERRED,

    @JsonProperty("tax_free")
    TAX_FREE;

    public boolean isTaxable() {
        return this == TAXABLE;
    }
}
