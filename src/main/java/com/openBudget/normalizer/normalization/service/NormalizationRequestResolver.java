package com.openBudget.normalizer.normalization.service;

import com.openBudget.normalizer.normalization.model.Currency;
import com.openBudget.normalizer.normalization.model.LegacyNormalization;
import com.openBudget.normalizer.normalization.model.NormalizationMode;
import com.openBudget.normalizer.normalization.model.NormalizationRequest;
import com.openBudget.normalizer.normalization.model.ResolvedNormalizationRequest;
import com.openBudget.normalizer.normalization.model.TransformationOptions;

/**
 * Decomposes client normalization values into strict (mode, currency) options.
 *
 * Precedence:
 * - An explicit currency overrides the one implied by the legacy value
 * - PERCENT_GDP always resolves to local currency
 * - Absent flags are false
 */
public final class NormalizationRequestResolver {

    private NormalizationRequestResolver() {
    }

    public static ResolvedNormalizationRequest resolve(NormalizationRequest request) {
        NormalizationRequest input = request != null ? request : new NormalizationRequest();
        LegacyNormalization legacy = input.getNormalization() != null
                ? input.getNormalization()
                : LegacyNormalization.TOTAL;

        NormalizationMode mode = modeOf(legacy);
        Currency currency = mode == NormalizationMode.PERCENT_GDP
                ? Currency.LOCAL
                : (input.getCurrency() != null ? input.getCurrency() : currencyOf(legacy));
        boolean inflationAdjusted = Boolean.TRUE.equals(input.getInflationAdjusted());
        boolean showPeriodGrowth = Boolean.TRUE.equals(input.getShowPeriodGrowth());

        return ResolvedNormalizationRequest.builder()
                .normalization(mode)
                .currency(currency)
                .inflationAdjusted(inflationAdjusted)
                .showPeriodGrowth(showPeriodGrowth)
                .transformation(TransformationOptions.builder()
                        .normalization(mode)
                        .currency(currency)
                        .inflationAdjusted(inflationAdjusted)
                        .showPeriodGrowth(showPeriodGrowth)
                        .build())
                .build();
    }

    private static NormalizationMode modeOf(LegacyNormalization legacy) {
        switch (legacy) {
            case PER_CAPITA:
            case PER_CAPITA_EURO:
                return NormalizationMode.PER_CAPITA;
            case PERCENT_GDP:
                return NormalizationMode.PERCENT_GDP;
            case TOTAL:
            case TOTAL_EURO:
            default:
                return NormalizationMode.TOTAL;
        }
    }

    private static Currency currencyOf(LegacyNormalization legacy) {
        return legacy == LegacyNormalization.TOTAL_EURO || legacy == LegacyNormalization.PER_CAPITA_EURO
                ? Currency.EUR
                : Currency.LOCAL;
    }
}
