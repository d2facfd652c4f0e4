package com.portfolio.projection.domain.service.montecarlo;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor(staticName = "of")
public class SimulationError {

    private final Kind kind;
    private final String message;

    public Category getCategory() {
        return kind.getCategory();
    }

    @Getter
    @RequiredArgsConstructor
    public enum Kind {
        NO_ASSET_CLASSES(Category.VALIDATION),
        INVALID_ASSET_CLASS(Category.VALIDATION),
        ALLOCATION_SUM_MISMATCH(Category.VALIDATION),
        TOO_FEW_SIMULATIONS(Category.VALIDATION),
        TIME_HORIZON_TOO_LONG(Category.VALIDATION),
        TIME_HORIZON_TOO_SHORT(Category.VALIDATION),
        INVALID_INITIAL_INVESTMENT(Category.VALIDATION),
        NEGATIVE_DRAWDOWN(Category.VALIDATION),
        INVALID_INFLATION_RATE(Category.VALIDATION),
        NEGATIVE_TAX_RATE(Category.VALIDATION),
        TAX_DEFERRED_RATE_TOO_HIGH(Category.CONFIGURATION),
        CANCELLED(Category.CANCELLED),
        INTERNAL_ERROR(Category.INTERNAL);

        private final Category category;
    }

    public enum Category {
        /** Caller-fixable problem with the request itself. */
        VALIDATION,
        /** Request settings that make the computation undefined. */
        CONFIGURATION,
        CANCELLED,
        /** Not caller-fixable. */
        INTERNAL
    }
}
