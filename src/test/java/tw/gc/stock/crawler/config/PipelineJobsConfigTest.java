package tw.gc.stock.crawler.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.services.fetch.FetchJob;
import tw.gc.stock.crawler.services.fetch.FetchOrchestrator;
import tw.gc.stock.crawler.services.fetch.FetchReport;
import tw.gc.stock.crawler.services.merge.MergeReport;
import tw.gc.stock.crawler.services.merge.UpsertMerger;
import tw.gc.stock.crawler.services.scheduling.PipelineJob;
import tw.gc.stock.crawler.sources.FetchTarget;
import tw.gc.stock.crawler.sources.records.DividendRecord;
import tw.gc.stock.crawler.sources.records.NormalizedRecord;
import tw.gc.stock.crawler.sources.records.QuoteRecord;
import tw.gc.stock.crawler.sources.records.StockIndexRecord;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PipelineJobsConfig")
class PipelineJobsConfigTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Mock
    private FetchOrchestrator fetchOrchestrator;
    @Mock
    private UpsertMerger upsertMerger;
    @Mock
    private StockRepository stockRepository;

    private PipelineJobsConfig config;

    @BeforeEach
    void setUp() {
        config = new PipelineJobsConfig(fetchOrchestrator, upsertMerger, stockRepository);
        when(fetchOrchestrator.execute(any(FetchJob.class))).thenAnswer(inv -> {
            FetchJob job = inv.getArgument(0);
            return new FetchReport(job.sourceName(), List.of(), List.of(), job.targets().size(), Duration.ZERO);
        });
        when(upsertMerger.merge(anyList())).thenReturn(MergeReport.EMPTY);
    }

    private List<String> keysFetchedBy(PipelineJob job) {
        job.run(DAY);
        ArgumentCaptor<FetchJob> captor = ArgumentCaptor.forClass(FetchJob.class);
        verify(fetchOrchestrator).execute(captor.capture());
        return captor.getValue().targets().stream().map(FetchTarget::key).toList();
    }

    @Nested
    @DisplayName("Fetch keys")
    class FetchKeys {

        @Test
        @DisplayName("per-period sources should read the period that just ended")
        void shouldDerivePeriods() {
            assertThat(keysFetchedBy(config.refreshRevenueJob())).containsExactly("202402");
        }

        @Test
        @DisplayName("annual statements should read the previous year")
        void shouldReadPreviousYear() {
            assertThat(keysFetchedBy(config.refreshAnnualFinancialsJob())).containsExactly("2023");
        }

        @Test
        @DisplayName("quarterly statements should read the last complete quarter")
        void shouldReadPreviousQuarter() {
            assertThat(keysFetchedBy(config.refreshQuarterlyFinancialsJob())).containsExactly("2023Q4");
        }

        @Test
        @DisplayName("security list should cover every market")
        void shouldCoverMarkets() {
            assertThat(keysFetchedBy(config.refreshSecurityListJob())).containsExactly("2", "4", "5");
        }

        @Test
        @DisplayName("per-security sources should read active securities")
        void shouldReadActiveSecurities() {
            when(stockRepository.findBySuspendListingFalseOrderByStockSymbolAsc()).thenReturn(List.of(
                    Stock.builder().stockSymbol("1101").build(),
                    Stock.builder().stockSymbol("2330").build()));

            assertThat(keysFetchedBy(config.refreshDividendJob())).containsExactly("1101", "2330");
        }

        @Test
        @DisplayName("emerging book values should only read the emerging market")
        void shouldReadEmergingMarket() {
            when(stockRepository.findByStockExchangeMarketIdAndSuspendListingFalseOrderByStockSymbolAsc(5))
                    .thenReturn(List.of(Stock.builder().stockSymbol("7777").build()));

            assertThat(keysFetchedBy(config.refreshEmergingNetAssetValueJob())).containsExactly("7777");
        }

        @Test
        @DisplayName("daily sources should read the business date")
        void shouldReadBusinessDate() {
            assertThat(keysFetchedBy(config.refreshForeignHoldingsJob())).containsExactly("2024-03-01");
        }
    }

    @Test
    @DisplayName("previousQuarter should roll over the year in the first quarter")
    void shouldComputePreviousQuarter() {
        assertThat(PipelineJobsConfig.previousQuarter(LocalDate.of(2024, 2, 10))).isEqualTo("2023Q4");
        assertThat(PipelineJobsConfig.previousQuarter(LocalDate.of(2024, 5, 10))).isEqualTo("2024Q1");
        assertThat(PipelineJobsConfig.previousQuarter(LocalDate.of(2024, 12, 31))).isEqualTo("2024Q3");
    }

    @Test
    @DisplayName("stampBusinessDate should only fill missing dates")
    void shouldStampMissingDates() {
        LocalDate other = LocalDate.of(2024, 2, 29);
        List<NormalizedRecord> records = List.of(
                QuoteRecord.builder().securityCode("2330").closingPrice(600.0).build(),
                QuoteRecord.builder().securityCode("2317").date(other).build(),
                StockIndexRecord.builder().category("TAIEX").build(),
                DividendRecord.builder().securityCode("2330").year(2023).build());

        List<NormalizedRecord> stamped = PipelineJobsConfig.stampBusinessDate(DAY)
                .handle(new FetchTarget("listed-quotes", "2024-03-01"), records);

        assertThat(((QuoteRecord) stamped.get(0)).date()).isEqualTo(DAY);
        assertThat(((QuoteRecord) stamped.get(0)).closingPrice()).isEqualTo(600.0);
        assertThat(((QuoteRecord) stamped.get(1)).date()).isEqualTo(other);
        assertThat(((StockIndexRecord) stamped.get(2)).date()).isEqualTo(DAY);
        assertThat(stamped.get(3)).isSameAs(records.get(3));
    }
}
