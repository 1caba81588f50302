package com.openBudget.normalizer.normalization.service;

import com.openBudget.normalizer.normalization.model.Currency;
import com.openBudget.normalizer.normalization.model.DataPoint;
import com.openBudget.normalizer.normalization.model.FactorMap;
import com.openBudget.normalizer.normalization.model.NormalizationFactors;
import com.openBudget.normalizer.normalization.model.NormalizationMode;
import com.openBudget.normalizer.normalization.model.TimeSeries;
import com.openBudget.normalizer.normalization.model.TransformationOptions;
import com.openBudget.normalizer.period.Frequency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("TransformPipeline")
class TransformPipelineTest {

    private static final BigDecimal TOLERANCE = new BigDecimal("0.0001");

    private final TransformPipeline pipeline = new TransformPipeline();

    @Nested
    @DisplayName("Percent of GDP")
    class PercentGdpTests {

        @Test
        @DisplayName("value is expressed as a share of GDP stored in millions")
        void percentGdp_share() {
            // Given
            TimeSeries series = yearly("2023", "16045540000");
            NormalizationFactors factors = NormalizationFactors.builder()
                    .gdp(factors("2023", "1604554"))
                    .build();

            // When
            TimeSeries result = pipeline.transform(series, options(NormalizationMode.PERCENT_GDP), factors, Frequency.YEAR);

            // Then
            assertThat(value(result, 0)).isCloseTo(new BigDecimal("1"), within(TOLERANCE));
        }

        @Test
        @DisplayName("missing or zero GDP gives 0 and keeps the point")
        void percentGdp_zeroGuard() {
            // Given
            TimeSeries series = yearly("2022", "500", "2023", "500");
            NormalizationFactors factors = NormalizationFactors.builder()
                    .gdp(factors("2023", "0"))
                    .build();

            // When
            TimeSeries result = pipeline.transform(series, options(NormalizationMode.PERCENT_GDP), factors, Frequency.YEAR);

            // Then
            assertThat(result.getPoints()).hasSize(2);
            assertThat(value(result, 0)).isEqualByComparingTo("0");
            assertThat(value(result, 1)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("inflation and currency options are ignored")
        void percentGdp_ignoresOtherAdjustments() {
            // Given
            TimeSeries series = yearly("2023", "1000000");
            NormalizationFactors factors = NormalizationFactors.builder()
                    .gdp(factors("2023", "1"))
                    .cpi(factors("2023", "50"))
                    .eur(factors("2023", "5"))
                    .cpiReference(new BigDecimal("100"))
                    .build();
            TransformationOptions options = TransformationOptions.builder()
                    .normalization(NormalizationMode.PERCENT_GDP)
                    .currency(Currency.EUR)
                    .inflationAdjusted(true)
                    .build();

            // When
            TimeSeries result = pipeline.transform(series, options, factors, Frequency.YEAR);

            // Then
            assertThat(value(result, 0)).isEqualByComparingTo("100");
        }
    }

    @Nested
    @DisplayName("Standard branch")
    class StandardBranchTests {

        @Test
        @DisplayName("inflation, currency and per capita are applied in order with each point's own factor")
        void standard_allSteps() {
            // Given
            TimeSeries series = yearly("2022", "1200", "2023", "1000");
            NormalizationFactors factors = NormalizationFactors.builder()
                    .cpi(factors("2022", "120", "2023", "100"))
                    .cpiReference(new BigDecimal("100"))
                    .eur(factors("2022", "5", "2023", "4"))
                    .population(factors("2022", "10", "2023", "25"))
                    .build();
            TransformationOptions options = TransformationOptions.builder()
                    .normalization(NormalizationMode.PER_CAPITA)
                    .currency(Currency.EUR)
                    .inflationAdjusted(true)
                    .build();

            // When
            TimeSeries result = pipeline.transform(series, options, factors, Frequency.YEAR);

            // Then
            assertThat(value(result, 0)).isCloseTo(new BigDecimal("20"), within(TOLERANCE));
            assertThat(value(result, 1)).isCloseTo(new BigDecimal("10"), within(TOLERANCE));
        }

        @Test
        @DisplayName("missing or zero price index passes the point through")
        void inflation_passThrough() {
            // Given
            TimeSeries series = yearly("2021", "70", "2022", "80", "2023", "90");
            NormalizationFactors factors = NormalizationFactors.builder()
                    .cpi(factors("2022", "0", "2023", "50"))
                    .cpiReference(new BigDecimal("100"))
                    .build();

            // When
            TimeSeries result = pipeline.transform(series, inflationOnly(), factors, Frequency.YEAR);

            // Then
            assertThat(value(result, 0)).isEqualByComparingTo("70");
            assertThat(value(result, 1)).isEqualByComparingTo("80");
            assertThat(value(result, 2)).isEqualByComparingTo("180");
        }

        @Test
        @DisplayName("no reference index disables inflation adjustment")
        void inflation_withoutReference() {
            TimeSeries series = yearly("2023", "90");
            NormalizationFactors factors = NormalizationFactors.builder()
                    .cpi(factors("2023", "50"))
                    .build();

            TimeSeries result = pipeline.transform(series, inflationOnly(), factors, Frequency.YEAR);

            assertThat(value(result, 0)).isEqualByComparingTo("90");
        }

        @Test
        @DisplayName("missing exchange rate or population passes the point through")
        void currencyAndPerCapita_passThrough() {
            TimeSeries series = yearly("2023", "90");
            TransformationOptions options = TransformationOptions.builder()
                    .normalization(NormalizationMode.PER_CAPITA)
                    .currency(Currency.USD)
                    .build();

            TimeSeries result = pipeline.transform(series, options, NormalizationFactors.builder().build(), Frequency.YEAR);

            assertThat(value(result, 0)).isEqualByComparingTo("90");
        }

        @Test
        @DisplayName("local currency total leaves values unchanged")
        void total_isIdentity() {
            TimeSeries series = yearly("2022", "1.5", "2023", "2.5");

            TimeSeries result = pipeline.transform(series, options(NormalizationMode.TOTAL),
                    NormalizationFactors.builder().eur(factors("2022", "5")).build(), Frequency.YEAR);

            assertThat(result.getPoints()).isEqualTo(series.getPoints());
        }
    }

    @Nested
    @DisplayName("Period growth")
    class GrowthTests {

        @Test
        @DisplayName("first point is 0 and later points are percentage change")
        void growth_basic() {
            TimeSeries series = yearly("2022", "100", "2023", "150", "2024", "75");

            TimeSeries result = pipeline.transform(series, growthOnly(), NormalizationFactors.builder().build(), Frequency.YEAR);

            assertThat(value(result, 0)).isEqualByComparingTo("0");
            assertThat(value(result, 1)).isEqualByComparingTo("50");
            assertThat(value(result, 2)).isEqualByComparingTo("-50");
        }

        @Test
        @DisplayName("Q1 compares with Q4 of the previous year and January with December")
        void growth_crossesYearBoundary() {
            TimeSeries quarters = TimeSeries.of(Frequency.QUARTER, List.of(
                    point("2023-Q4", "200"), point("2024-Q1", "250")));
            TimeSeries months = TimeSeries.of(Frequency.MONTH, List.of(
                    point("2023-12", "40"), point("2024-01", "30")));

            TimeSeries quarterResult = pipeline.transform(quarters, growthOnly(), NormalizationFactors.builder().build(), Frequency.QUARTER);
            TimeSeries monthResult = pipeline.transform(months, growthOnly(), NormalizationFactors.builder().build(), Frequency.MONTH);

            assertThat(value(quarterResult, 1)).isEqualByComparingTo("25");
            assertThat(value(monthResult, 1)).isEqualByComparingTo("-25");
        }

        @Test
        @DisplayName("a gap or a zero predecessor gives 0")
        void growth_gapsAndZeros() {
            TimeSeries series = yearly("2020", "0", "2021", "10", "2023", "20");

            TimeSeries result = pipeline.transform(series, growthOnly(), NormalizationFactors.builder().build(), Frequency.YEAR);

            assertThat(value(result, 1)).isEqualByComparingTo("0");
            assertThat(value(result, 2)).isEqualByComparingTo("0");
        }
    }

    @Test
    @DisplayName("each output point depends only on its own period, whatever the input order")
    void transform_isOrderIndependent() {
        // Given
        List<DataPoint> points = new ArrayList<>(List.of(
                point("2021", "300"), point("2022", "1200"), point("2023", "1000")));
        NormalizationFactors factors = NormalizationFactors.builder()
                .cpi(factors("2021", "90", "2022", "120", "2023", "100"))
                .cpiReference(new BigDecimal("100"))
                .usd(factors("2021", "3", "2022", "4", "2023", "5"))
                .build();
        TransformationOptions options = TransformationOptions.builder()
                .currency(Currency.USD)
                .inflationAdjusted(true)
                .build();

        // When
        TimeSeries ordered = pipeline.transform(TimeSeries.of(Frequency.YEAR, points), options, factors, Frequency.YEAR);
        Collections.reverse(points);
        TimeSeries reversed = pipeline.transform(TimeSeries.of(Frequency.YEAR, points), options, factors, Frequency.YEAR);

        // Then
        assertThat(toMap(reversed)).isEqualTo(toMap(ordered));
        assertThat(reversed.getPoints().get(0).getLabel()).isEqualTo("2023");
    }

    @Test
    @DisplayName("normalizing per point then summing differs from summing raw values then normalizing once")
    void transform_aggregatesAfterNormalization() {
        // Given
        TimeSeries series = yearly("2022", "100", "2023", "110");
        NormalizationFactors factors = NormalizationFactors.builder()
                .cpi(factors("2022", "120", "2023", "100"))
                .cpiReference(new BigDecimal("100"))
                .build();

        // When
        BigDecimal perPointSum = pipeline.transform(series, inflationOnly(), factors, Frequency.YEAR)
                .getPoints().stream()
                .map(DataPoint::getValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal naiveSum = value(pipeline.transform(yearly("2023", "210"), inflationOnly(), factors, Frequency.YEAR), 0);

        // Then
        assertThat(perPointSum).isCloseTo(new BigDecimal("193.3333"), within(TOLERANCE));
        assertThat(naiveSum).isEqualByComparingTo("210");
        assertThat(perPointSum).isNotEqualByComparingTo(naiveSum);
    }

    @Test
    @DisplayName("points passed through unchanged are copies of the input points")
    void transform_doesNotShareInputPoints() {
        // Given
        DataPoint input = point("2021", "300");
        TimeSeries series = TimeSeries.of(Frequency.YEAR, List.of(input));
        NormalizationFactors factors = NormalizationFactors.builder()
                .cpi(factors("2023", "100"))
                .cpiReference(new BigDecimal("100"))
                .build();

        // When
        TimeSeries result = pipeline.transform(series, inflationOnly(), factors, Frequency.YEAR);
        result.getPoints().get(0).setValue(new BigDecimal("999"));

        // Then
        assertThat(result.getPoints().get(0)).isNotSameAs(input);
        assertThat(input.getValue()).isEqualByComparingTo("300");
    }

    @Test
    @DisplayName("inflation adjustment then growth on a two-year series")
    void endToEnd_inflationThenGrowth() {
        // Given
        TimeSeries series = yearly("2022", "100", "2023", "110");
        NormalizationFactors factors = NormalizationFactors.builder()
                .cpi(factors("2022", "120", "2023", "100"))
                .cpiReference(new BigDecimal("100"))
                .cpiReferenceYear(2023)
                .build();

        // When
        TimeSeries adjusted = pipeline.transform(series, inflationOnly(), factors, Frequency.YEAR);
        TimeSeries growth = pipeline.transform(series, TransformationOptions.builder()
                .inflationAdjusted(true)
                .showPeriodGrowth(true)
                .build(), factors, Frequency.YEAR);

        // Then
        assertThat(value(adjusted, 0)).isCloseTo(new BigDecimal("83.3333"), within(TOLERANCE));
        assertThat(value(adjusted, 1)).isEqualByComparingTo("110");
        assertThat(value(growth, 0)).isEqualByComparingTo("0");
        assertThat(value(growth, 1)).isCloseTo(new BigDecimal("32"), within(TOLERANCE));
    }

    private static TransformationOptions options(NormalizationMode mode) {
        return TransformationOptions.builder().normalization(mode).build();
    }

    private static TransformationOptions inflationOnly() {
        return TransformationOptions.builder().inflationAdjusted(true).build();
    }

    private static TransformationOptions growthOnly() {
        return TransformationOptions.builder().showPeriodGrowth(true).build();
    }

    private static DataPoint point(String label, String value) {
        return DataPoint.of(label, new BigDecimal(value));
    }

    /**
     * Builds a yearly series from alternating label/value pairs.
     */
    private static TimeSeries yearly(String... labelValues) {
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < labelValues.length; i += 2) {
            points.add(point(labelValues[i], labelValues[i + 1]));
        }
        return TimeSeries.of(Frequency.YEAR, points);
    }

    private static FactorMap factors(String... labelValues) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (int i = 0; i < labelValues.length; i += 2) {
            values.put(labelValues[i], new BigDecimal(labelValues[i + 1]));
        }
        return FactorMap.of(values);
    }

    private static BigDecimal value(TimeSeries series, int index) {
        return series.getPoints().get(index).getValue();
    }

    private static Map<String, BigDecimal> toMap(TimeSeries series) {
        Map<String, BigDecimal> byLabel = new LinkedHashMap<>();
        for (DataPoint point : series.getPoints()) {
            byLabel.put(point.getLabel(), point.getValue().stripTrailingZeros());
        }
        return byLabel;
    }
}
