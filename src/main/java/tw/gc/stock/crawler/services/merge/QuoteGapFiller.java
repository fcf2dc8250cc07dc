package tw.gc.stock.crawler.services.merge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.sources.records.QuoteRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Gives every active security a quote row on a trading day.
 *
 * <p>A security without a quote on the date (halted, no trades) gets a copy of
 * its latest quote from the preceding {@value #LOOKBACK_DAYS} days: the four
 * prices are carried over, volumes, turnover, change, best bid/ask and P/E are
 * zero. Securities with no quote in that window are left alone. Nothing is
 * filled when the date has no quotes at all.</p>
 *
 * Rows are written through {@link UpsertMerger}, so a rerun changes nothing
 * and a real quote merged later overwrites the copy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuoteGapFiller {

    static final int LOOKBACK_DAYS = 30;

    private final StockRepository stockRepository;
    private final DailyQuoteRepository dailyQuoteRepository;
    private final UpsertMerger upsertMerger;

    public record FillReport(int missing, int filled, int noHistory, int failed) {

        public static final FillReport EMPTY = new FillReport(0, 0, 0, 0);
    }

    public FillReport fill(LocalDate date) {
        Set<String> quoted = new HashSet<>(dailyQuoteRepository.findSecurityCodesByDate(date));
        if (quoted.isEmpty()) {
            log.warn("⚠️ No quotes stored for {}, gaps not filled", date);
            return FillReport.EMPTY;
        }

        LocalDate windowStart = date.minusDays(LOOKBACK_DAYS);
        List<QuoteRecord> copies = new ArrayList<>();
        int missing = 0;
        int noHistory = 0;
        for (Stock stock : stockRepository.findBySuspendListingFalseOrderByStockSymbolAsc()) {
            String code = stock.getStockSymbol();
            if (quoted.contains(code)) {
                continue;
            }
            missing++;
            Optional<DailyQuote> previous = dailyQuoteRepository
                    .findFirstBySecurityCodeAndDateLessThanEqualOrderByDateDesc(code, date.minusDays(1))
                    .filter(quote -> quote.getDate().isAfter(windowStart));
            if (previous.isEmpty()) {
                noHistory++;
                continue;
            }
            copies.add(carryOver(previous.get(), date));
        }

        MergeReport merged = upsertMerger.merge(copies);
        FillReport report = new FillReport(missing, merged.applied() + merged.unchanged(), noHistory, merged.failed());
        log.info("🩹 Quote gaps for {}: {} missing, {} filled, {} without recent quote, {} failed",
                date, missing, report.filled(), noHistory, report.failed());
        return report;
    }

    static QuoteRecord carryOver(DailyQuote previous, LocalDate date) {
        return QuoteRecord.builder()
                .securityCode(previous.getSecurityCode())
                .date(date)
                .openingPrice(previous.getOpeningPrice())
                .highestPrice(previous.getHighestPrice())
                .lowestPrice(previous.getLowestPrice())
                .closingPrice(previous.getClosingPrice())
                .tradingVolume(0.0)
                .transaction(0.0)
                .tradeValue(0.0)
                .change(0.0)
                .changeRange(0.0)
                .lastBestBidPrice(0.0)
                .lastBestBidVolume(0.0)
                .lastBestAskPrice(0.0)
                .lastBestAskVolume(0.0)
                .priceEarningRatio(0.0)
                .build();
    }
}
