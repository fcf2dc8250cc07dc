package tw.gc.stock.crawler.services.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.Dividend;
import tw.gc.stock.crawler.entities.FinancialStatement;
import tw.gc.stock.crawler.entities.Revenue;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.repositories.DividendRepository;
import tw.gc.stock.crawler.repositories.FinancialStatementRepository;
import tw.gc.stock.crawler.repositories.RevenueCursorRepository;
import tw.gc.stock.crawler.repositories.RevenueRepository;
import tw.gc.stock.crawler.repositories.StockIndexRepository;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.services.SecurityLockRegistry;
import tw.gc.stock.crawler.services.merge.UpsertMerger.Outcome;
import tw.gc.stock.crawler.sources.records.DividendRecord;
import tw.gc.stock.crawler.sources.records.FinancialStatementRecord;
import tw.gc.stock.crawler.sources.records.QuoteRecord;
import tw.gc.stock.crawler.sources.records.RevenueRecord;
import tw.gc.stock.crawler.sources.records.SecurityInfoRecord;
import tw.gc.stock.crawler.sources.records.StockIndexRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import({UpsertMerger.class, SecurityLockRegistry.class})
@DisplayName("UpsertMerger")
class UpsertMergerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Autowired
    private UpsertMerger merger;

    @Autowired
    private StockRepository stockRepository;

    @Autowired
    private DailyQuoteRepository dailyQuoteRepository;

    @Autowired
    private DividendRepository dividendRepository;

    @Autowired
    private FinancialStatementRepository financialStatementRepository;

    @Autowired
    private RevenueRepository revenueRepository;

    @Autowired
    private RevenueCursorRepository revenueCursorRepository;

    @Autowired
    private StockIndexRepository stockIndexRepository;

    private static QuoteRecord quote(String code, LocalDate date, double close) {
        return QuoteRecord.builder()
                .securityCode(code).date(date)
                .openingPrice(close - 1).highestPrice(close + 1).lowestPrice(close - 2).closingPrice(close)
                .tradingVolume(1000.0)
                .build();
    }

    private static FinancialStatementRecord quarter(int year, String quarter, double eps) {
        return FinancialStatementRecord.builder()
                .securityCode("2330").year(year).quarter(quarter)
                .earningsPerShare(eps).returnOnEquity(eps * 2)
                .build();
    }

    @Nested
    @DisplayName("Quotes")
    class Quotes {

        @Test
        @DisplayName("merging the same batch twice should leave one row per key")
        void shouldBeIdempotent() {
            List<QuoteRecord> batch = List.of(quote("2330", DAY, 600.0), quote("2317", DAY, 100.0));

            MergeReport first = merger.merge(batch);
            MergeReport second = merger.merge(batch);

            assertThat(first.applied()).isEqualTo(2);
            assertThat(second.applied()).isZero();
            assertThat(second.unchanged()).isEqualTo(2);
            assertThat(dailyQuoteRepository.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("should overwrite only the fields the record carries")
        void shouldOverwritePartially() {
            merger.mergeOne(quote("2330", DAY, 600.0));

            Outcome outcome = merger.mergeOne(QuoteRecord.builder()
                    .securityCode("2330").date(DAY).closingPrice(605.0).build());

            DailyQuote stored = dailyQuoteRepository.findBySecurityCodeAndDate("2330", DAY).orElseThrow();
            assertThat(outcome).isEqualTo(Outcome.APPLIED);
            assertThat(stored.getClosingPrice()).isEqualTo(605.0);
            assertThat(stored.getOpeningPrice()).isEqualTo(599.0);
        }

        @Test
        @DisplayName("should register a security first seen in a quote")
        void shouldRegisterUnknownSecurity() {
            merger.mergeOne(quote("6666", DAY, 50.0));

            assertThat(stockRepository.findById("6666")).isPresent();
        }

        @Test
        @DisplayName("should reject a quote without a date and keep going")
        void shouldRejectInvalidRecord() {
            QuoteRecord undated = QuoteRecord.builder().securityCode("2330").closingPrice(600.0).build();

            MergeReport report = merger.merge(List.of(undated, quote("2317", DAY, 100.0)));

            assertThat(report.applied()).isEqualTo(1);
            assertThat(report.rejected()).singleElement()
                    .satisfies(rejected -> assertThat(rejected.reason()).isEqualTo("missing date"));
            assertThat(report.failed()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("dividend without quarter should be stored as the annual row with its sum")
    void shouldStoreAnnualDividend() {
        merger.mergeOne(DividendRecord.builder()
                .securityCode("2330").year(2023).cashDividend(11.0).stockDividend(0.0).build());

        Dividend stored = dividendRepository.findBySecurityCodeAndYearAndQuarter("2330", 2023, "").orElseThrow();
        assertThat(stored.getSum()).isEqualTo(11.0);
    }

    @Nested
    @DisplayName("Financial statements")
    class FinancialStatements {

        @Test
        @DisplayName("newest quarter should refresh trailing EPS on the security")
        void shouldRefreshTrailingEps() {
            merger.mergeOne(SecurityInfoRecord.builder().securityCode("2330").name("TSMC").build());

            merger.merge(List.of(
                    quarter(2023, "Q1", 1.0), quarter(2023, "Q2", 2.0),
                    quarter(2023, "Q3", 3.0), quarter(2023, "Q4", 4.0)));

            Stock stock = stockRepository.findById("2330").orElseThrow();
            assertThat(stock.getLastOneEps()).isEqualTo(4.0);
            assertThat(stock.getLastFourEps()).isEqualTo(10.0);
            assertThat(stock.getReturnOnEquity()).isEqualTo(8.0);
        }

        @Test
        @DisplayName("an older quarter should not move trailing EPS")
        void shouldIgnoreOlderQuarter() {
            merger.mergeOne(SecurityInfoRecord.builder().securityCode("2330").name("TSMC").build());
            merger.merge(List.of(quarter(2023, "Q3", 3.0), quarter(2023, "Q4", 4.0)));

            merger.mergeOne(quarter(2022, "Q4", 9.0));

            Stock stock = stockRepository.findById("2330").orElseThrow();
            assertThat(stock.getLastOneEps()).isEqualTo(4.0);
            assertThat(stock.getLastFourEps()).isEqualTo(7.0);
        }
    }

    @Nested
    @DisplayName("Revenue cursor")
    class RevenueCursorGate {

        private RevenueRecord revenue(long month, double monthly) {
            return RevenueRecord.builder().securityCode("2330").month(month).monthly(monthly).build();
        }

        @Test
        @DisplayName("should apply a month and fill its price range from quotes")
        void shouldApplyAndFillPrices() {
            merger.merge(List.of(
                    quote("2330", LocalDate.of(2024, 3, 1), 600.0),
                    quote("2330", LocalDate.of(2024, 3, 4), 620.0),
                    quote("2330", LocalDate.of(2024, 3, 5), 610.0)));

            Outcome outcome = merger.mergeOne(revenue(202403L, 1_000_000.0));

            Revenue stored = revenueRepository.findBySecurityCodeAndMonth("2330", 202403L).orElseThrow();
            assertThat(outcome).isEqualTo(Outcome.APPLIED);
            assertThat(stored.getAvgPrice()).isEqualTo(610.0);
            assertThat(stored.getLowestPrice()).isEqualTo(600.0);
            assertThat(stored.getHighestPrice()).isEqualTo(620.0);
            assertThat(revenueCursorRepository.findById("2330").orElseThrow().getMonth()).isEqualTo(202403L);
        }

        @Test
        @DisplayName("should skip a month at or before the cursor")
        void shouldSkipStaleMonth() {
            merger.mergeOne(revenue(202403L, 1_000_000.0));

            assertThat(merger.mergeOne(revenue(202403L, 2_000_000.0))).isEqualTo(Outcome.UNCHANGED);
            assertThat(merger.mergeOne(revenue(202402L, 3_000_000.0))).isEqualTo(Outcome.UNCHANGED);
            assertThat(revenueRepository.findBySecurityCodeAndMonth("2330", 202402L)).isEmpty();
            assertThat(revenueRepository.findBySecurityCodeAndMonth("2330", 202403L).orElseThrow().getMonthly())
                    .isEqualTo(1_000_000.0);
        }

        @Test
        @DisplayName("should reject a malformed month")
        void shouldRejectBadMonth() {
            assertThatThrownBy(() -> merger.mergeOne(revenue(202413L, 1.0)))
                    .isInstanceOf(RecordValidationException.class)
                    .hasMessageContaining("yyyyMM");
        }
    }

    @Test
    @DisplayName("index records should upsert by category and date")
    void shouldUpsertIndex() {
        StockIndexRecord taiex = StockIndexRecord.builder().category("TAIEX").date(DAY).index(18000.0).build();

        merger.mergeOne(taiex);
        Outcome again = merger.mergeOne(taiex.toBuilder().index(18050.0).build());

        assertThat(again).isEqualTo(Outcome.APPLIED);
        assertThat(stockIndexRepository.findByCategoryAndDate("TAIEX", DAY).orElseThrow().getIndex())
                .isEqualTo(18050.0);
        assertThat(stockIndexRepository.count()).isEqualTo(1);
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        /**
         * Lets the clock move so that a needless update would show in {@code updatedTime}.
         */
        private void pause() throws InterruptedException {
            Thread.sleep(20);
        }

        @Test
        @DisplayName("merging the same dividends twice should change nothing")
        void shouldMergeDividendsOnce() throws InterruptedException {
            List<DividendRecord> batch = List.of(
                    DividendRecord.builder().securityCode("2330").year(2023).cashDividend(11.0).stockDividend(0.0).build(),
                    DividendRecord.builder().securityCode("2330").year(2023).quarter("Q4")
                            .cashDividend(3.0).stockDividend(0.0).build());
            merger.merge(batch);
            LocalDateTime touched = dividendRepository
                    .findBySecurityCodeAndYearAndQuarter("2330", 2023, "").orElseThrow().getUpdatedTime();
            pause();

            MergeReport second = merger.merge(batch);

            assertThat(second.unchanged()).isEqualTo(2);
            assertThat(second.applied()).isZero();
            assertThat(dividendRepository.count()).isEqualTo(2);
            assertThat(dividendRepository.findBySecurityCodeAndYearAndQuarter("2330", 2023, "").orElseThrow()
                    .getUpdatedTime()).isEqualTo(touched);
        }

        @Test
        @DisplayName("merging the same financial statements twice should leave trailing EPS alone")
        void shouldMergeFinancialStatementsOnce() throws InterruptedException {
            merger.mergeOne(SecurityInfoRecord.builder().securityCode("2330").name("TSMC").build());
            List<FinancialStatementRecord> batch = List.of(
                    quarter(2023, "Q1", 1.0), quarter(2023, "Q2", 2.0),
                    quarter(2023, "Q3", 3.0), quarter(2023, "Q4", 4.0));
            merger.merge(batch);
            LocalDateTime statementTouched = financialStatementRepository
                    .findBySecurityCodeAndYearAndQuarter("2330", 2023, "Q4").orElseThrow().getUpdatedTime();
            Stock before = stockRepository.findById("2330").orElseThrow();
            double lastFourEps = before.getLastFourEps();
            LocalDateTime stockTouched = before.getUpdatedTime();
            pause();

            MergeReport second = merger.merge(batch);

            FinancialStatement q4 = financialStatementRepository
                    .findBySecurityCodeAndYearAndQuarter("2330", 2023, "Q4").orElseThrow();
            Stock after = stockRepository.findById("2330").orElseThrow();
            assertThat(second.unchanged()).isEqualTo(4);
            assertThat(financialStatementRepository.count()).isEqualTo(4);
            assertThat(q4.getUpdatedTime()).isEqualTo(statementTouched);
            assertThat(after.getLastFourEps()).isEqualTo(lastFourEps).isEqualTo(10.0);
            assertThat(after.getUpdatedTime()).isEqualTo(stockTouched);
        }

        @Test
        @DisplayName("merging the same revenue twice should keep one row and the cursor")
        void shouldMergeRevenueOnce() throws InterruptedException {
            List<RevenueRecord> batch = List.of(
                    RevenueRecord.builder().securityCode("2330").month(202402L).monthly(900_000.0).build(),
                    RevenueRecord.builder().securityCode("2330").month(202403L).monthly(1_000_000.0).build());
            merger.merge(batch);
            LocalDateTime cursorTouched = revenueCursorRepository.findById("2330").orElseThrow().getUpdatedTime();
            pause();

            MergeReport second = merger.merge(batch);

            assertThat(second.unchanged()).isEqualTo(2);
            assertThat(revenueRepository.count()).isEqualTo(2);
            assertThat(revenueRepository.findBySecurityCodeAndMonth("2330", 202403L).orElseThrow().getMonthly())
                    .isEqualTo(1_000_000.0);
            assertThat(revenueCursorRepository.findById("2330").orElseThrow().getUpdatedTime())
                    .isEqualTo(cursorTouched);
        }

        @Test
        @DisplayName("merging the same security info twice should not touch the security")
        void shouldMergeSecurityInfoOnce() throws InterruptedException {
            List<SecurityInfoRecord> batch = List.of(
                    SecurityInfoRecord.builder().securityCode("2330").name("TSMC").stockExchangeMarketId(2).build(),
                    SecurityInfoRecord.builder().securityCode("2317").name("Hon Hai").stockExchangeMarketId(2).build());
            merger.merge(batch);
            LocalDateTime touched = stockRepository.findById("2330").orElseThrow().getUpdatedTime();
            pause();

            MergeReport second = merger.merge(batch);

            assertThat(second.unchanged()).isEqualTo(2);
            assertThat(stockRepository.count()).isEqualTo(2);
            assertThat(stockRepository.findById("2330").orElseThrow().getUpdatedTime()).isEqualTo(touched);
        }

        @Test
        @DisplayName("merging the same index values twice should not touch the row")
        void shouldMergeIndexOnce() throws InterruptedException {
            List<StockIndexRecord> batch = List.of(
                    StockIndexRecord.builder().category("TAIEX").date(DAY).index(18000.0).change(50.0).build(),
                    StockIndexRecord.builder().category("TPEX").date(DAY).index(230.0).change(-1.0).build());
            merger.merge(batch);
            LocalDateTime touched = stockIndexRepository.findByCategoryAndDate("TAIEX", DAY).orElseThrow()
                    .getUpdatedTime();
            pause();

            MergeReport second = merger.merge(batch);

            assertThat(second.unchanged()).isEqualTo(2);
            assertThat(stockIndexRepository.count()).isEqualTo(2);
            assertThat(stockIndexRepository.findByCategoryAndDate("TAIEX", DAY).orElseThrow().getUpdatedTime())
                    .isEqualTo(touched);
        }
    }
}
