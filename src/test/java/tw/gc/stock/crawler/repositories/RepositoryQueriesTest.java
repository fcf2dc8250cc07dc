package tw.gc.stock.crawler.repositories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.FinancialStatement;
import tw.gc.stock.crawler.entities.JobExecution;
import tw.gc.stock.crawler.entities.StockOwnershipDetail;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
class RepositoryQueriesTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Autowired
    private DailyQuoteRepository dailyQuoteRepository;

    @Autowired
    private FinancialStatementRepository financialStatementRepository;

    @Autowired
    private StockOwnershipDetailRepository stockOwnershipDetailRepository;

    @Autowired
    private JobExecutionRepository jobExecutionRepository;

    private void quote(String code, LocalDate date, double close) {
        dailyQuoteRepository.save(DailyQuote.builder().securityCode(code).date(date).closingPrice(close).build());
    }

    private void statement(String code, int year, String quarter, double eps) {
        financialStatementRepository.save(FinancialStatement.builder()
                .securityCode(code).year(year).quarter(quarter).earningsPerShare(eps).build());
    }

    private StockOwnershipDetail lot(long member, String code, LocalDate bought, LocalDate sold) {
        return stockOwnershipDetailRepository.save(StockOwnershipDetail.builder()
                .memberId(member).securityCode(code).date(bought).shareQuantity(1000L).holdingCost(10000.0)
                .isSold(sold != null).soldDate(sold).build());
    }

    @Test
    @DisplayName("latest quote per code should ignore older days")
    void latestQuotePerCode() {
        quote("2330", DAY.minusDays(1), 595);
        quote("2330", DAY, 600);
        quote("1101", DAY.minusDays(3), 40);
        quote("2317", DAY, 104);

        List<DailyQuote> latest = dailyQuoteRepository.findLatestBySecurityCodes(List.of("2330", "1101"));

        assertThat(latest).extracting(DailyQuote::getSecurityCode, DailyQuote::getClosingPrice)
                .containsExactlyInAnyOrder(tuple("2330", 600.0), tuple("1101", 40.0));
    }

    @Test
    @DisplayName("codes quoted on a date should be distinct and sorted")
    void codesQuotedOnDate() {
        quote("2330", DAY, 600);
        quote("1101", DAY, 40);
        quote("2317", DAY.minusDays(1), 104);

        assertThat(dailyQuoteRepository.findSecurityCodesByDate(DAY)).containsExactly("1101", "2330");
    }

    @Test
    @DisplayName("quote window should be newest first and bounded by the page")
    void quoteWindow() {
        for (int i = 0; i < 10; i++) {
            quote("2330", DAY.minusDays(i), 600 - i);
        }

        List<DailyQuote> window = dailyQuoteRepository.findBySecurityCodeAndDateLessThanEqualOrderByDateDesc(
                "2330", DAY.minusDays(2), PageRequest.of(0, 3));

        assertThat(window).extracting(DailyQuote::getDate)
                .containsExactly(DAY.minusDays(2), DAY.minusDays(3), DAY.minusDays(4));
    }

    @Test
    @DisplayName("quarter queries should leave annual rows out")
    void quarterQueriesSkipAnnualRows() {
        statement("2330", 2023, "Q3", 8.14);
        statement("2330", 2023, "Q4", 9.21);
        statement("2330", 2023, "", 32.34);
        statement("2330", 2024, "Q1", 8.70);

        assertThat(financialStatementRepository.findLatestQuarters("2330", PageRequest.of(0, 2)))
                .extracting(FinancialStatement::getYear, FinancialStatement::getQuarter)
                .containsExactly(tuple(2024, "Q1"), tuple(2023, "Q4"));
        assertThat(financialStatementRepository.findQuartersBetween("2330", 2023, 2023))
                .extracting(FinancialStatement::getQuarter)
                .containsExactly("Q3", "Q4");
    }

    @Test
    @DisplayName("lots held on a date should include lots sold later")
    void lotsHeldOnDate() {
        lot(7L, "2330", DAY.minusDays(30), null);
        lot(7L, "1101", DAY.minusDays(30), DAY.plusDays(1));
        lot(7L, "2317", DAY.minusDays(30), DAY);
        lot(7L, "2454", DAY.plusDays(1), null);

        assertThat(stockOwnershipDetailRepository.findLotsHeldOn(7L, DAY))
                .extracting(StockOwnershipDetail::getSecurityCode)
                .containsExactly("1101", "2330");
    }

    @Test
    @DisplayName("members with only long-closed lots should drop out")
    void membersWithOpenOrRecentlyClosedLots() {
        lot(1L, "2330", DAY.minusDays(60), null);
        lot(2L, "2330", DAY.minusDays(60), DAY.minusDays(3));
        lot(3L, "2330", DAY.minusDays(60), DAY.minusDays(30));

        assertThat(stockOwnershipDetailRepository.findMembersWithOpenOrRecentlyClosedLots(DAY, DAY.minusDays(7)))
                .containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("one execution row per job and business date")
    void jobExecutionIsUniquePerDate() {
        jobExecutionRepository.saveAndFlush(JobExecution.builder()
                .jobName("closing").businessDate(DAY).status(JobExecution.Status.SUCCEEDED).build());

        assertThat(jobExecutionRepository.findByJobNameAndBusinessDate("closing", DAY)).isPresent();
        assertThatThrownBy(() -> jobExecutionRepository.saveAndFlush(JobExecution.builder()
                .jobName("closing").businessDate(DAY).status(JobExecution.Status.RUNNING).build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
