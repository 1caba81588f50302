package com.openBudget.normalizer.period;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats period labels: "2023" (year), "2023-Q2" (quarter), "2023-07" (month).
 *
 * Parsing never throws. Anything that does not match the strict pattern for the
 * requested frequency is reported as an empty result.
 */
public final class PeriodLabels {

    private static final Pattern YEAR_PATTERN = Pattern.compile("^(\\d{4})$");
    private static final Pattern QUARTER_PATTERN = Pattern.compile("^(\\d{4})-Q(\\d)$");
    private static final Pattern MONTH_PATTERN = Pattern.compile("^(\\d{4})-(\\d{2})$");

    private PeriodLabels() {
    }

    /**
     * Formats a period label.
     *
     * @param year Four digit year
     * @param subPeriod Quarter (1-4) or month (1-12); ignored for YEAR
     * @param frequency Target frequency
     * @return The canonical label
     */
    public static String format(int year, int subPeriod, Frequency frequency) {
        switch (frequency) {
            case QUARTER:
                return year + "-Q" + subPeriod;
            case MONTH:
                return String.format("%d-%02d", year, subPeriod);
            case YEAR:
            default:
                return Integer.toString(year);
        }
    }

    /**
     * Computes the label of the period immediately before {@code label}.
     * Q1 rolls over to Q4 of the prior year, January to December of the prior year.
     *
     * @return the previous label, or empty when {@code label} is not a valid label for the frequency
     */
    public static Optional<String> previousLabel(String label, Frequency frequency) {
        if (label == null || frequency == null) {
            return Optional.empty();
        }

        switch (frequency) {
            case YEAR: {
                Matcher matcher = YEAR_PATTERN.matcher(label);
                if (!matcher.matches()) {
                    return Optional.empty();
                }
                int year = Integer.parseInt(matcher.group(1));
                return Optional.of(format(year - 1, 1, Frequency.YEAR));
            }
            case QUARTER: {
                Matcher matcher = QUARTER_PATTERN.matcher(label);
                if (!matcher.matches()) {
                    return Optional.empty();
                }
                int year = Integer.parseInt(matcher.group(1));
                int quarter = Integer.parseInt(matcher.group(2));
                if (quarter < 1 || quarter > 4) {
                    return Optional.empty();
                }
                return quarter == 1
                        ? Optional.of(format(year - 1, 4, Frequency.QUARTER))
                        : Optional.of(format(year, quarter - 1, Frequency.QUARTER));
            }
            case MONTH: {
                Matcher matcher = MONTH_PATTERN.matcher(label);
                if (!matcher.matches()) {
                    return Optional.empty();
                }
                int year = Integer.parseInt(matcher.group(1));
                int month = Integer.parseInt(matcher.group(2));
                if (month < 1 || month > 12) {
                    return Optional.empty();
                }
                return month == 1
                        ? Optional.of(format(year - 1, 12, Frequency.MONTH))
                        : Optional.of(format(year, month - 1, Frequency.MONTH));
            }
            default:
                return Optional.empty();
        }
    }

    /**
     * Extracts the year from any label whose first four characters are digits.
     */
    public static Optional<Integer> extractYear(String label) {
        if (label == null || label.length() < 4) {
            return Optional.empty();
        }
        for (int i = 0; i < 4; i++) {
            char c = label.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }
        return Optional.of(Integer.parseInt(label.substring(0, 4)));
    }

    /**
     * Strict validation of a label against a frequency, including the quarter
     * and month ranges.
     */
    public static boolean isValid(String label, Frequency frequency) {
        if (label == null || frequency == null) {
            return false;
        }
        switch (frequency) {
            case YEAR:
                return YEAR_PATTERN.matcher(label).matches();
            case QUARTER: {
                Matcher matcher = QUARTER_PATTERN.matcher(label);
                if (!matcher.matches()) {
                    return false;
                }
                int quarter = Integer.parseInt(matcher.group(2));
                return quarter >= 1 && quarter <= 4;
            }
            case MONTH: {
                Matcher matcher = MONTH_PATTERN.matcher(label);
                if (!matcher.matches()) {
                    return false;
                }
                int month = Integer.parseInt(matcher.group(2));
                return month >= 1 && month <= 12;
            }
            default:
                return false;
        }
    }

    /**
     * Lists every label of the year range in chronological order.
     * An inverted range yields an empty list.
     */
    public static List<String> labelsFor(int startYear, int endYear, Frequency frequency) {
        List<String> labels = new ArrayList<>();
        for (int year = startYear; year <= endYear; year++) {
            for (int subPeriod = 1; subPeriod <= frequency.getSubPeriodsPerYear(); subPeriod++) {
                labels.add(format(year, subPeriod, frequency));
            }
        }
        return labels;
    }

    /**
     * Quarter (1-4) containing the given month (1-12).
     */
    public static int quarterOfMonth(int month) {
        return (month - 1) / 3 + 1;
    }
}
