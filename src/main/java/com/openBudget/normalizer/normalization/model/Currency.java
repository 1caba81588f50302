package com.openBudget.normalizer.normalization.model;

/**
 * Output currency. LOCAL keeps the nominal local-currency amounts.
 */
public enum Currency {
    LOCAL,
    EUR,
    USD;

    public boolean isForeign() {
        return this != LOCAL;
    }
}
