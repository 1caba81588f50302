package com.openBudget.normalizer.normalization.model;

import com.openBudget.normalizer.period.PeriodLabels;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;

/**
 * Inclusive range of years factors are generated for.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class YearRange {

    private int startYear;

    private int endYear;

    public static YearRange of(int startYear, int endYear) {
        return new YearRange(startYear, endYear);
    }

    /**
     * Smallest range covering every parseable label; {@code fallbackYear} when none parse.
     */
    public static YearRange covering(Collection<String> labels, int fallbackYear) {
        Integer min = null;
        Integer max = null;
        for (String label : labels) {
            Integer year = PeriodLabels.extractYear(label).orElse(null);
            if (year == null) {
                continue;
            }
            min = min == null ? year : Math.min(min, year);
            max = max == null ? year : Math.max(max, year);
        }
        return min == null ? of(fallbackYear, fallbackYear) : of(min, max);
    }
}
