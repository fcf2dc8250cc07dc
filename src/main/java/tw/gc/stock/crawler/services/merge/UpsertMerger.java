package tw.gc.stock.crawler.services.merge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.Dividend;
import tw.gc.stock.crawler.entities.FinancialStatement;
import tw.gc.stock.crawler.entities.Revenue;
import tw.gc.stock.crawler.entities.RevenueCursor;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.entities.StockIndex;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.repositories.DividendRepository;
import tw.gc.stock.crawler.repositories.FinancialStatementRepository;
import tw.gc.stock.crawler.repositories.RevenueCursorRepository;
import tw.gc.stock.crawler.repositories.RevenueRepository;
import tw.gc.stock.crawler.repositories.StockIndexRepository;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.services.SecurityLockRegistry;
import tw.gc.stock.crawler.sources.records.DividendRecord;
import tw.gc.stock.crawler.sources.records.FinancialStatementRecord;
import tw.gc.stock.crawler.sources.records.NormalizedRecord;
import tw.gc.stock.crawler.sources.records.QuoteRecord;
import tw.gc.stock.crawler.sources.records.RevenueRecord;
import tw.gc.stock.crawler.sources.records.SecurityInfoRecord;
import tw.gc.stock.crawler.sources.records.StockIndexRecord;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Optional;

/**
 * Writes normalized records into the canonical store.
 *
 * <h3>Isolation:</h3>
 * <ul>
 *   <li>Each record is applied in its own transaction, under the lock of its
 *       security</li>
 *   <li>A rejected or conflicting record is reported and the batch carries on</li>
 * </ul>
 *
 * <h3>Rules per kind:</h3>
 * <ul>
 *   <li>Quote, dividend, financial statement, security info, index - overwrite
 *       on the natural key</li>
 *   <li>Revenue - gated by the per-security month cursor</li>
 * </ul>
 *
 * @see MergeRules
 */
@Service
@Slf4j
public class UpsertMerger {

    public enum Outcome { APPLIED, UNCHANGED }

    private final StockRepository stockRepository;
    private final DailyQuoteRepository dailyQuoteRepository;
    private final DividendRepository dividendRepository;
    private final FinancialStatementRepository financialStatementRepository;
    private final RevenueRepository revenueRepository;
    private final RevenueCursorRepository revenueCursorRepository;
    private final StockIndexRepository stockIndexRepository;
    private final SecurityLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;

    public UpsertMerger(StockRepository stockRepository,
                        DailyQuoteRepository dailyQuoteRepository,
                        DividendRepository dividendRepository,
                        FinancialStatementRepository financialStatementRepository,
                        RevenueRepository revenueRepository,
                        RevenueCursorRepository revenueCursorRepository,
                        StockIndexRepository stockIndexRepository,
                        SecurityLockRegistry lockRegistry,
                        PlatformTransactionManager transactionManager) {
        this.stockRepository = stockRepository;
        this.dailyQuoteRepository = dailyQuoteRepository;
        this.dividendRepository = dividendRepository;
        this.financialStatementRepository = financialStatementRepository;
        this.revenueRepository = revenueRepository;
        this.revenueCursorRepository = revenueCursorRepository;
        this.stockIndexRepository = stockIndexRepository;
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // ========== Public API ==========

    public MergeReport merge(List<? extends NormalizedRecord> records) {
        if (records == null || records.isEmpty()) {
            return MergeReport.EMPTY;
        }

        int applied = 0;
        int unchanged = 0;
        int conflicts = 0;
        List<RejectedRecord> rejected = new ArrayList<>();

        for (NormalizedRecord record : records) {
            try {
                if (mergeOne(record) == Outcome.APPLIED) {
                    applied++;
                } else {
                    unchanged++;
                }
            } catch (RecordValidationException e) {
                log.warn("Rejected {} record {}: {}", kindOf(record), e.getRecordKey(), e.getMessage());
                rejected.add(new RejectedRecord(e.getRecordKey(), e.getMessage()));
            } catch (ConflictException e) {
                log.error("❌ {}", e.getMessage());
                conflicts++;
            } catch (RuntimeException e) {
                String key = keyOf(record);
                log.error("❌ Failed to merge {} record {}", kindOf(record), key, e);
                rejected.add(new RejectedRecord(key, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        MergeReport report = new MergeReport(applied, unchanged, List.copyOf(rejected), conflicts);
        log.info("🔀 Merged {} records: {} applied, {} unchanged, {} rejected, {} conflicts",
                records.size(), applied, unchanged, rejected.size(), conflicts);
        return report;
    }

    /**
     * Applies one record in its own transaction.
     *
     * @throws RecordValidationException when the record has no usable natural key
     * @throws ConflictException         when the store refuses the write
     */
    public Outcome mergeOne(NormalizedRecord record) {
        if (record == null) {
            throw new RecordValidationException("null", "record is null");
        }
        validateKey(record);
        String lockKey = lockKeyOf(record);
        return lockRegistry.withLock(lockKey, () -> {
            try {
                return transactionTemplate.execute(status -> apply(record));
            } catch (DataIntegrityViolationException e) {
                throw new ConflictException(record.naturalKey(), e);
            }
        });
    }

    private Outcome apply(NormalizedRecord record) {
        if (record instanceof QuoteRecord quote) {
            return applyQuote(quote);
        } else if (record instanceof DividendRecord dividend) {
            return applyDividend(dividend);
        } else if (record instanceof FinancialStatementRecord statement) {
            return applyFinancialStatement(statement);
        } else if (record instanceof RevenueRecord revenue) {
            return applyRevenue(revenue);
        } else if (record instanceof SecurityInfoRecord info) {
            return applySecurityInfo(info);
        } else if (record instanceof StockIndexRecord index) {
            return applyStockIndex(index);
        }
        throw new RecordValidationException(record.naturalKey(),
                "unsupported record type " + record.getClass().getSimpleName());
    }

    /**
     * Natural key checks, done before any lock or transaction is taken.
     */
    private static void validateKey(NormalizedRecord record) {
        if (record instanceof StockIndexRecord index) {
            require(blankToNull(index.category()), record, "category");
            require(index.date(), record, "date");
            return;
        }
        requireCode(record);
        if (record instanceof QuoteRecord quote) {
            require(quote.date(), record, "date");
        } else if (record instanceof DividendRecord dividend) {
            require(dividend.year(), record, "year");
        } else if (record instanceof FinancialStatementRecord statement) {
            require(statement.year(), record, "year");
        } else if (record instanceof RevenueRecord revenue) {
            toYearMonth(require(revenue.month(), record, "month"), record);
        }
    }

    // ========== Per Kind ==========

    private Outcome applyQuote(QuoteRecord in) {
        String code = in.securityCode().trim();
        LocalDate date = in.date();

        // Quotes may arrive before the security list knows the code
        if (!stockRepository.existsById(code)) {
            log.info("📝 Registering unknown security {} from quote of {}", code, date);
            stockRepository.save(Stock.builder().stockSymbol(code).build());
        }

        Optional<DailyQuote> existing = dailyQuoteRepository.findBySecurityCodeAndDate(code, date);
        DailyQuote target = existing.orElseGet(() -> DailyQuote.builder().securityCode(code).date(date).build());
        return save(existing.isPresent(), MergeRules.overwrite(target, in), () -> dailyQuoteRepository.saveAndFlush(target));
    }

    private Outcome applyDividend(DividendRecord in) {
        String code = in.securityCode().trim();
        Integer year = in.year();
        String quarter = in.quarter() == null ? "" : in.quarter().trim();

        Optional<Dividend> existing = dividendRepository.findBySecurityCodeAndYearAndQuarter(code, year, quarter);
        Dividend target = existing.orElseGet(() -> Dividend.builder()
                .securityCode(code).year(year).quarter(quarter).build());
        return save(existing.isPresent(), MergeRules.overwrite(target, in), () -> dividendRepository.saveAndFlush(target));
    }

    private Outcome applyFinancialStatement(FinancialStatementRecord in) {
        String code = in.securityCode().trim();
        Integer year = in.year();
        String quarter = in.quarter() == null ? "" : in.quarter().trim();

        Optional<FinancialStatement> existing =
                financialStatementRepository.findBySecurityCodeAndYearAndQuarter(code, year, quarter);
        FinancialStatement target = existing.orElseGet(() -> FinancialStatement.builder()
                .securityCode(code).year(year).quarter(quarter).build());
        Outcome outcome = save(existing.isPresent(), MergeRules.overwrite(target, in),
                () -> financialStatementRepository.saveAndFlush(target));

        if (target.isQuarterly()) {
            refreshTrailingEarnings(code, target);
        }
        return outcome;
    }

    /**
     * Copies trailing EPS and ROE onto the stock when {@code statement} is its
     * newest quarter.
     */
    private void refreshTrailingEarnings(String code, FinancialStatement statement) {
        List<FinancialStatement> latest = financialStatementRepository.findLatestQuarters(code, PageRequest.of(0, 4));
        if (latest.isEmpty() || !latest.get(0).getId().equals(statement.getId())) {
            return;
        }
        stockRepository.findById(code).ifPresent(stock -> {
            double lastFour = latest.stream().mapToDouble(FinancialStatement::getEarningsPerShare).sum();
            stock.setLastOneEps(statement.getEarningsPerShare());
            stock.setLastFourEps(lastFour);
            stock.setReturnOnEquity(statement.getReturnOnEquity());
            stockRepository.save(stock);
        });
    }

    private Outcome applyRevenue(RevenueRecord in) {
        String code = in.securityCode().trim();
        Long month = in.month();
        YearMonth yearMonth = toYearMonth(month, in);

        RevenueCursor cursor = revenueCursorRepository.findById(code)
                .orElseGet(() -> RevenueCursor.builder().securityCode(code).build());
        if (!MergeRules.cursorAllows(cursor.getMonth(), month)) {
            log.debug("Revenue {} skipped, cursor of {} is at {}", month, code, cursor.getMonth());
            return Outcome.UNCHANGED;
        }

        Revenue target = revenueRepository.findBySecurityCodeAndMonth(code, month)
                .orElseGet(() -> Revenue.builder().securityCode(code).month(month).build());
        MergeRules.overwrite(target, in);
        fillMonthPrices(target, code, yearMonth);
        revenueRepository.saveAndFlush(target);

        cursor.setMonth(month);
        revenueCursorRepository.save(cursor);
        return Outcome.APPLIED;
    }

    private void fillMonthPrices(Revenue revenue, String code, YearMonth month) {
        DoubleSummaryStatistics stats = dailyQuoteRepository
                .findBySecurityCodeAndDateBetweenOrderByDateAsc(code, month.atDay(1), month.atEndOfMonth())
                .stream()
                .mapToDouble(DailyQuote::getClosingPrice)
                .filter(price -> price > 0)
                .summaryStatistics();
        if (stats.getCount() == 0) {
            return;
        }
        revenue.setAvgPrice(stats.getAverage());
        revenue.setLowestPrice(stats.getMin());
        revenue.setHighestPrice(stats.getMax());
    }

    private Outcome applySecurityInfo(SecurityInfoRecord in) {
        String code = in.securityCode().trim();

        Optional<Stock> existing = stockRepository.findById(code);
        Stock target = existing.orElseGet(() -> Stock.builder().stockSymbol(code).build());
        return save(existing.isPresent(), MergeRules.overwrite(target, in), () -> stockRepository.saveAndFlush(target));
    }

    private Outcome applyStockIndex(StockIndexRecord in) {
        String category = in.category().trim();
        LocalDate date = in.date();

        Optional<StockIndex> existing = stockIndexRepository.findByCategoryAndDate(category, date);
        StockIndex target = existing.orElseGet(() -> StockIndex.builder().category(category).date(date).build());
        return save(existing.isPresent(), MergeRules.overwrite(target, in), () -> stockIndexRepository.saveAndFlush(target));
    }

    // ========== Helpers ==========

    private static Outcome save(boolean exists, boolean changed, Runnable saver) {
        if (exists && !changed) {
            return Outcome.UNCHANGED;
        }
        saver.run();
        return Outcome.APPLIED;
    }

    private static String requireCode(NormalizedRecord record) {
        return require(blankToNull(record.securityCode()), record, "security code");
    }

    private static <T> T require(T value, NormalizedRecord record, String field) {
        if (value == null) {
            throw new RecordValidationException(record.naturalKey(), "missing " + field);
        }
        return value;
    }

    private static YearMonth toYearMonth(long month, NormalizedRecord record) {
        int year = (int) (month / 100);
        int monthOfYear = (int) (month % 100);
        if (year < 1900 || monthOfYear < 1 || monthOfYear > 12) {
            throw new RecordValidationException(record.naturalKey(), "month must be yyyyMM, got " + month);
        }
        return YearMonth.of(year, monthOfYear);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String lockKeyOf(NormalizedRecord record) {
        if (record instanceof StockIndexRecord index) {
            return "index:" + index.category();
        }
        String code = record.securityCode();
        return code == null ? "" : code.trim();
    }

    private static String keyOf(NormalizedRecord record) {
        return record == null ? "null" : record.naturalKey();
    }

    private static String kindOf(NormalizedRecord record) {
        return record == null ? "unknown" : record.kind().name().toLowerCase();
    }
}
