package tw.gc.stock.crawler.services.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.entities.YieldRank;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.repositories.DividendRepository;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.repositories.YieldRankRepository;
import tw.gc.stock.crawler.services.metrics.AnnualDividends.AnnualDividend;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dividend yield of every active security for a date.
 *
 * <p>Yield is the latest annual dividend total of the date's year or the year
 * before, divided by the day's close. A security with no dividend in that
 * window gets no row. Each row records the quote and dividend rows it
 * was computed from. The rank itself is never stored; {@link #ranking} orders
 * the stored yields on read.</p>
 */
@Service
@Slf4j
public class YieldRankService {

    private final StockRepository stockRepository;
    private final DailyQuoteRepository dailyQuoteRepository;
    private final DividendRepository dividendRepository;
    private final YieldRankRepository yieldRankRepository;
    private final TransactionTemplate transactionTemplate;

    public record YieldReport(int ranked, int skipped, int failed) {}

    public record RankedYield(int rank, String securityCode, double dividendYield, Long dailyQuoteId, Long dividendId) {}

    public YieldRankService(StockRepository stockRepository,
                            DailyQuoteRepository dailyQuoteRepository,
                            DividendRepository dividendRepository,
                            YieldRankRepository yieldRankRepository,
                            PlatformTransactionManager transactionManager) {
        this.stockRepository = stockRepository;
        this.dailyQuoteRepository = dailyQuoteRepository;
        this.dividendRepository = dividendRepository;
        this.yieldRankRepository = yieldRankRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // ========== Public API ==========

    public YieldReport computeForDate(LocalDate date) {
        int ranked = 0;
        int skipped = 0;
        int failed = 0;

        for (Stock stock : stockRepository.findBySuspendListingFalseOrderByStockSymbolAsc()) {
            String code = stock.getStockSymbol();
            try {
                if (computeSecurity(code, date).isPresent()) {
                    ranked++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.error("❌ Yield failed for {} on {}", code, date, e);
                failed++;
            }
        }

        log.info("🏆 Dividend yields for {}: {} stored, {} skipped, {} failed", date, ranked, skipped, failed);
        return new YieldReport(ranked, skipped, failed);
    }

    public Optional<YieldRank> computeSecurity(String code, LocalDate date) {
        return Optional.ofNullable(transactionTemplate.execute(status -> recompute(code, date)));
    }

    /**
     * Highest yield first; ties ordered by security code.
     */
    @Transactional(readOnly = true)
    public List<RankedYield> ranking(LocalDate date, int limit) {
        List<YieldRank> rows = yieldRankRepository.findByDateOrderByDividendYieldDescSecurityCodeAsc(
                date, PageRequest.of(0, Math.max(1, limit)));
        List<RankedYield> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            YieldRank row = rows.get(i);
            result.add(new RankedYield(i + 1, row.getSecurityCode(), row.getDividendYield(),
                    row.getDailyQuoteId(), row.getDividendId()));
        }
        return result;
    }

    // ========== Computation ==========

    private YieldRank recompute(String code, LocalDate date) {
        Optional<DailyQuote> quote = dailyQuoteRepository.findBySecurityCodeAndDate(code, date);
        if (quote.isEmpty() || quote.get().getClosingPrice() <= 0) {
            return null;
        }
        int year = date.getYear();
        Optional<AnnualDividend> dividend = AnnualDividends.latest(
                dividendRepository.findBySecurityCodeAndYearBetweenOrderByYearAscQuarterAsc(code, year - 1, year),
                year);
        if (dividend.isEmpty()) {
            return null;
        }

        YieldRank row = yieldRankRepository.findByDateAndSecurityCode(date, code)
                .orElseGet(() -> YieldRank.builder().date(date).securityCode(code).build());
        row.setDailyQuoteId(quote.get().getId());
        row.setDividendId(dividend.get().source().getId());
        row.setDividendYield(dividend.get().total() / quote.get().getClosingPrice());
        return yieldRankRepository.save(row);
    }
}
