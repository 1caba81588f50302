package com.openBudget.normalizer.normalization.service;

import com.openBudget.normalizer.dataset.exception.DatasetStoreException;
import com.openBudget.normalizer.dataset.exception.DatasetStoreException.ErrorType;
import com.openBudget.normalizer.dataset.model.Dataset;
import com.openBudget.normalizer.dataset.model.DatasetPoint;
import com.openBudget.normalizer.dataset.service.DatasetStore;
import com.openBudget.normalizer.normalization.exception.NormalizationDatasetException;
import com.openBudget.normalizer.normalization.model.DataPoint;
import com.openBudget.normalizer.normalization.model.NormalizationFactors;
import com.openBudget.normalizer.normalization.model.NormalizationMode;
import com.openBudget.normalizer.normalization.model.NormalizationResult;
import com.openBudget.normalizer.normalization.model.TimeSeries;
import com.openBudget.normalizer.normalization.model.TransformationOptions;
import com.openBudget.normalizer.normalization.model.YearRange;
import com.openBudget.normalizer.normalization.registry.DatasetRegistry;
import com.openBudget.normalizer.normalization.registry.DimensionDatasetConfig;
import com.openBudget.normalizer.normalization.registry.NormalizationDimension;
import com.openBudget.normalizer.period.Frequency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("NormalizationService")
class NormalizationServiceTest {

    private static final String CPI = "ro.economics.cpi.yearly";
    private static final String EUR = "ro.economics.exchange.ron_eur.yearly";
    private static final String USD = "ro.economics.exchange.ron_usd.yearly";
    private static final String GDP = "ro.economics.gdp.yearly";
    private static final String POPULATION = "ro.demographics.population.yearly";

    @Mock
    private DatasetStore datasetStore;

    private final DatasetRegistry registry = DatasetRegistry.defaults();

    @BeforeEach
    void setUp() throws DatasetStoreException {
        when(datasetStore.getById(CPI)).thenReturn(yearlyDataset(CPI, "2022", "120", "2023", "100"));
        when(datasetStore.getById(EUR)).thenReturn(yearlyDataset(EUR, "2022", "4.9315", "2023", "4.9465"));
        when(datasetStore.getById(USD)).thenReturn(yearlyDataset(USD, "2022", "4.6885", "2023", "4.5743"));
        when(datasetStore.getById(GDP)).thenReturn(yearlyDataset(GDP, "2022", "1403693", "2023", "1604554"));
        when(datasetStore.getById(POPULATION)).thenReturn(yearlyDataset(POPULATION, "2022", "19042455", "2023", "19051562"));
    }

    @Nested
    @DisplayName("Creation")
    class CreationTests {

        @Test
        @DisplayName("validates every required dataset")
        void create_validatesRequiredDatasets() throws DatasetStoreException {
            NormalizationService.create(datasetStore, registry, null);

            for (String id : registry.requiredDatasetIds()) {
                verify(datasetStore).getById(id);
            }
        }

        @Test
        @DisplayName("reports every missing dataset, not just the first")
        void create_aggregatesAllFailures() throws DatasetStoreException {
            // Given
            when(datasetStore.getById(EUR)).thenThrow(new DatasetStoreException(ErrorType.NOT_FOUND, "no eur"));
            when(datasetStore.getById(POPULATION)).thenThrow(new DatasetStoreException(ErrorType.PARSE_ERROR, "bad json"));

            // When / Then
            assertThatThrownBy(() -> NormalizationService.create(datasetStore, registry, null))
                    .isInstanceOfSatisfying(NormalizationDatasetException.class, e -> {
                        assertThat(e.getMissingDatasets()).containsExactly(EUR, POPULATION);
                        assertThat(e.getErrors()).containsEntry(EUR, "no eur").containsEntry(POPULATION, "bad json");
                        assertThat(e.getMessage()).contains("Required normalization datasets are missing")
                                .contains(EUR + ": no eur");
                    });
        }
    }

    @Nested
    @DisplayName("Factors")
    class FactorTests {

        @Test
        @DisplayName("price index anchor is the latest yearly value")
        void generateFactors_latestReference() {
            NormalizationService service = NormalizationService.create(datasetStore, registry, null);

            NormalizationFactors factors = service.generateFactors(Frequency.YEAR, 2022, 2023);

            assertThat(factors.getCpiReferenceYear()).isEqualTo(2023);
            assertThat(factors.getCpiReference()).isEqualByComparingTo("100");
            assertThat(factors.getGdp().get("2022")).isEqualByComparingTo("1403693");
        }

        @Test
        @DisplayName("a configured reference year pins the anchor")
        void generateFactors_configuredReference() {
            NormalizationService service = NormalizationService.create(datasetStore, registry, 2022);

            NormalizationFactors factors = service.generateFactors(Frequency.MONTH, 2023, 2023);

            assertThat(factors.getCpiReference()).isEqualByComparingTo("120");
            assertThat(factors.getCpi().size()).isEqualTo(12);
        }

        @Test
        @DisplayName("datasets are loaded once until the cache is invalidated")
        void generateFactors_cachesDatasets() throws DatasetStoreException {
            // Given
            NormalizationService service = NormalizationService.create(datasetStore, registry, null);

            // When
            service.generateFactors(Frequency.YEAR, 2022, 2023);
            service.generateFactors(Frequency.QUARTER, 2020, 2024);

            // Then: one call during validation plus one load
            verify(datasetStore, times(2)).getById(CPI);

            service.invalidateCache();
            service.generateFactors(Frequency.YEAR, 2022, 2023);
            verify(datasetStore, times(3)).getById(CPI);
        }
    }

    @Nested
    @DisplayName("Normalize")
    class NormalizeTests {

        @Test
        @DisplayName("inflation adjustment expresses values at the reference price level")
        void normalize_inflationAdjusted() {
            // Given
            NormalizationService service = NormalizationService.create(datasetStore, registry, null);
            TimeSeries series = TimeSeries.of(Frequency.YEAR, List.of(
                    DataPoint.of("2022", new BigDecimal("100")),
                    DataPoint.of("2023", new BigDecimal("110"))));

            // When
            NormalizationResult result = service.normalize(series,
                    TransformationOptions.builder().inflationAdjusted(true).build(),
                    Frequency.YEAR, YearRange.of(2022, 2023));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCpiReferenceYear()).isEqualTo(2023);
            assertThat(result.getSeries().getPoints().get(0).getValue())
                    .isCloseTo(new BigDecimal("83.3333"), within(new BigDecimal("0.0001")));
            assertThat(result.getSeries().getPoints().get(1).getValue()).isEqualByComparingTo("110");
        }

        @Test
        @DisplayName("a population denominator replaces the population dataset")
        void normalize_withPopulationDenominator() {
            NormalizationService service = NormalizationService.create(datasetStore, registry, null);
            TimeSeries series = TimeSeries.of(Frequency.QUARTER, List.of(
                    DataPoint.of("2023-Q1", new BigDecimal("5000")),
                    DataPoint.of("2023-Q2", new BigDecimal("2500"))));

            NormalizationResult result = service.normalize(series,
                    TransformationOptions.builder().normalization(NormalizationMode.PER_CAPITA).build(),
                    Frequency.QUARTER, YearRange.of(2023, 2023), new BigDecimal("1000"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSeries().getPoints().get(0).getValue()).isEqualByComparingTo("5");
            assertThat(result.getSeries().getPoints().get(1).getValue()).isEqualByComparingTo("2.5");
        }

        @Test
        @DisplayName("a transform failure is returned as a failed result")
        void normalize_reportsFailure() {
            // Given
            TransformPipeline failingPipeline = mock(TransformPipeline.class);
            when(failingPipeline.transform(any(), any(), any(), eq(Frequency.YEAR)))
                    .thenThrow(new IllegalStateException("boom"));
            NormalizationService service = NormalizationService.create(
                    datasetStore, registry, new FactorMapGenerator(), failingPipeline, null);

            // When
            NormalizationResult result = service.normalize(TimeSeries.of(Frequency.YEAR, List.of()),
                    TransformationOptions.builder().build(), Frequency.YEAR, YearRange.of(2023, 2023));

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getSeries()).isNull();
            assertThat(result.getErrorMessage()).isEqualTo("boom");
        }

        @Test
        @DisplayName("a required dataset failing after a reload is reported and retried on the next request")
        void normalize_requiredDatasetFailure() throws DatasetStoreException {
            // Given
            NormalizationService service = NormalizationService.create(datasetStore, registry, null);
            TimeSeries series = TimeSeries.of(Frequency.YEAR, List.of(DataPoint.of("2022", new BigDecimal("100"))));
            TransformationOptions options = TransformationOptions.builder().inflationAdjusted(true).build();
            when(datasetStore.getById(CPI)).thenThrow(new DatasetStoreException(ErrorType.READ_ERROR, "gone"));
            service.invalidateCache();

            // When
            NormalizationResult duringOutage = service.normalize(series, options, Frequency.YEAR, YearRange.of(2022, 2023));

            // Then
            assertThat(duringOutage.isSuccess()).isFalse();
            assertThat(duringOutage.getErrorMessage()).contains(CPI).contains("gone");

            // When the store recovers
            doReturn(yearlyDataset(CPI, "2022", "120", "2023", "100")).when(datasetStore).getById(CPI);
            NormalizationResult afterRecovery = service.normalize(series, options, Frequency.YEAR, YearRange.of(2022, 2023));

            // Then
            assertThat(afterRecovery.isSuccess()).isTrue();
            assertThat(afterRecovery.getSeries().getPoints().get(0).getValue())
                    .isCloseTo(new BigDecimal("83.3333"), within(new BigDecimal("0.0001")));
        }

        @Test
        @DisplayName("an optional dataset failing degrades to the yearly factors")
        void normalize_optionalDatasetFailure() throws DatasetStoreException {
            // Given
            String quarterlyCpi = "ro.economics.cpi.quarterly";
            Map<NormalizationDimension, DimensionDatasetConfig> configs = new EnumMap<>(NormalizationDimension.class);
            for (NormalizationDimension dimension : NormalizationDimension.values()) {
                configs.put(dimension, registry.config(dimension));
            }
            configs.put(NormalizationDimension.CPI, DimensionDatasetConfig.builder().yearly(CPI).quarterly(quarterlyCpi).build());
            when(datasetStore.getById(quarterlyCpi)).thenThrow(new DatasetStoreException(ErrorType.NOT_FOUND, "no quarterly"));
            NormalizationService service = NormalizationService.create(datasetStore, new DatasetRegistry(configs), null);

            // When
            NormalizationResult result = service.normalize(
                    TimeSeries.of(Frequency.QUARTER, List.of(DataPoint.of("2022-Q3", new BigDecimal("100")))),
                    TransformationOptions.builder().inflationAdjusted(true).build(),
                    Frequency.QUARTER, YearRange.of(2022, 2023));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSeries().getPoints().get(0).getValue())
                    .isCloseTo(new BigDecimal("83.3333"), within(new BigDecimal("0.0001")));
        }
    }

    private static Dataset yearlyDataset(String id, String... labelValues) {
        List<DatasetPoint> points = new ArrayList<>();
        for (int i = 0; i < labelValues.length; i += 2) {
            points.add(DatasetPoint.builder().label(labelValues[i]).value(new BigDecimal(labelValues[i + 1])).build());
        }
        return Dataset.builder()
                .id(id)
                .source("test")
                .lastUpdated("2025-01-01")
                .units("unit")
                .frequency(Frequency.YEAR)
                .points(points)
                .build();
    }
}
