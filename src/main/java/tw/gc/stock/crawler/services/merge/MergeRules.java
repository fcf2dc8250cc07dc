package tw.gc.stock.crawler.services.merge;

import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.Dividend;
import tw.gc.stock.crawler.entities.FinancialStatement;
import tw.gc.stock.crawler.entities.Revenue;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.entities.StockIndex;
import tw.gc.stock.crawler.sources.records.DividendRecord;
import tw.gc.stock.crawler.sources.records.FinancialStatementRecord;
import tw.gc.stock.crawler.sources.records.QuoteRecord;
import tw.gc.stock.crawler.sources.records.RevenueRecord;
import tw.gc.stock.crawler.sources.records.SecurityInfoRecord;
import tw.gc.stock.crawler.sources.records.StockIndexRecord;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Storage independent merge rules.
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li><b>Overwrite</b> - non-null incoming fields replace stored ones, field by
 *       field. Returns whether anything changed so that an identical batch
 *       leaves the row (and its {@code updatedTime}) alone.</li>
 *   <li><b>Monotonic extremes</b> - a candidate replaces the stored extreme only
 *       when strictly better. Ties keep the earlier date. A zero or unset stored
 *       extreme is always replaced.</li>
 *   <li><b>Cursor gating</b> - a period is applied only when strictly after the
 *       stored cursor.</li>
 * </ul>
 */
public final class MergeRules {

    private MergeRules() {
    }

    // ========== Overwrite ==========

    public static boolean overwrite(DailyQuote target, QuoteRecord in) {
        return new Changes()
                .set(in.openingPrice(), target::getOpeningPrice, target::setOpeningPrice)
                .set(in.highestPrice(), target::getHighestPrice, target::setHighestPrice)
                .set(in.lowestPrice(), target::getLowestPrice, target::setLowestPrice)
                .set(in.closingPrice(), target::getClosingPrice, target::setClosingPrice)
                .set(in.tradingVolume(), target::getTradingVolume, target::setTradingVolume)
                .set(in.transaction(), target::getTransaction, target::setTransaction)
                .set(in.tradeValue(), target::getTradeValue, target::setTradeValue)
                .set(in.change(), target::getChange, target::setChange)
                .set(in.changeRange(), target::getChangeRange, target::setChangeRange)
                .set(in.lastBestBidPrice(), target::getLastBestBidPrice, target::setLastBestBidPrice)
                .set(in.lastBestBidVolume(), target::getLastBestBidVolume, target::setLastBestBidVolume)
                .set(in.lastBestAskPrice(), target::getLastBestAskPrice, target::setLastBestAskPrice)
                .set(in.lastBestAskVolume(), target::getLastBestAskVolume, target::setLastBestAskVolume)
                .set(in.priceEarningRatio(), target::getPriceEarningRatio, target::setPriceEarningRatio)
                .changed();
    }

    /**
     * Besides the field overwrite, {@code sum} is recomputed as cash + stock
     * whenever both parts are known after the merge.
     */
    public static boolean overwrite(Dividend target, DividendRecord in) {
        Changes changes = new Changes()
                .set(in.yearOfDividend(), target::getYearOfDividend, target::setYearOfDividend)
                .set(in.cashDividend(), target::getCashDividend, target::setCashDividend)
                .set(in.stockDividend(), target::getStockDividend, target::setStockDividend)
                .set(in.capitalReserveCashDividend(), target::getCapitalReserveCashDividend,
                        target::setCapitalReserveCashDividend)
                .set(in.earningsCashDividend(), target::getEarningsCashDividend, target::setEarningsCashDividend)
                .set(in.capitalReserveStockDividend(), target::getCapitalReserveStockDividend,
                        target::setCapitalReserveStockDividend)
                .set(in.earningsStockDividend(), target::getEarningsStockDividend, target::setEarningsStockDividend)
                .set(in.exDividendDate(), target::getExDividendDate, target::setExDividendDate)
                .set(in.exRightsDate(), target::getExRightsDate, target::setExRightsDate)
                .set(in.payableDate(), target::getPayableDate, target::setPayableDate)
                .set(in.stockPayableDate(), target::getStockPayableDate, target::setStockPayableDate)
                .set(in.payoutRatioCash(), target::getPayoutRatioCash, target::setPayoutRatioCash)
                .set(in.payoutRatioStock(), target::getPayoutRatioStock, target::setPayoutRatioStock)
                .set(in.payoutRatio(), target::getPayoutRatio, target::setPayoutRatio);

        if (target.getCashDividend() != null && target.getStockDividend() != null) {
            changes.set(target.getCashDividend() + target.getStockDividend(), target::getSum, target::setSum);
        }
        return changes.changed();
    }

    public static boolean overwrite(FinancialStatement target, FinancialStatementRecord in) {
        return new Changes()
                .set(in.grossProfit(), target::getGrossProfit, target::setGrossProfit)
                .set(in.operatingProfitMargin(), target::getOperatingProfitMargin, target::setOperatingProfitMargin)
                .set(in.preTaxIncome(), target::getPreTaxIncome, target::setPreTaxIncome)
                .set(in.netIncome(), target::getNetIncome, target::setNetIncome)
                .set(in.netAssetValuePerShare(), target::getNetAssetValuePerShare, target::setNetAssetValuePerShare)
                .set(in.salesPerShare(), target::getSalesPerShare, target::setSalesPerShare)
                .set(in.earningsPerShare(), target::getEarningsPerShare, target::setEarningsPerShare)
                .set(in.profitBeforeTax(), target::getProfitBeforeTax, target::setProfitBeforeTax)
                .set(in.returnOnEquity(), target::getReturnOnEquity, target::setReturnOnEquity)
                .set(in.returnOnAssets(), target::getReturnOnAssets, target::setReturnOnAssets)
                .changed();
    }

    public static boolean overwrite(Revenue target, RevenueRecord in) {
        return new Changes()
                .set(in.monthly(), target::getMonthly, target::setMonthly)
                .set(in.lastMonth(), target::getLastMonth, target::setLastMonth)
                .set(in.lastYearThisMonth(), target::getLastYearThisMonth, target::setLastYearThisMonth)
                .set(in.monthlyAccumulated(), target::getMonthlyAccumulated, target::setMonthlyAccumulated)
                .set(in.lastYearMonthlyAccumulated(), target::getLastYearMonthlyAccumulated,
                        target::setLastYearMonthlyAccumulated)
                .set(in.comparedWithLastMonth(), target::getComparedWithLastMonth, target::setComparedWithLastMonth)
                .set(in.comparedWithLastYearSameMonth(), target::getComparedWithLastYearSameMonth,
                        target::setComparedWithLastYearSameMonth)
                .set(in.accumulatedComparedWithLastYear(), target::getAccumulatedComparedWithLastYear,
                        target::setAccumulatedComparedWithLastYear)
                .changed();
    }

    public static boolean overwrite(Stock target, SecurityInfoRecord in) {
        return new Changes()
                .set(blankToNull(in.name()), target::getName, target::setName)
                .set(in.stockExchangeMarketId(), target::getStockExchangeMarketId, target::setStockExchangeMarketId)
                .set(in.stockIndustryId(), target::getStockIndustryId, target::setStockIndustryId)
                .set(in.netAssetValuePerShare(), target::getNetAssetValuePerShare, target::setNetAssetValuePerShare)
                .set(in.suspendListing(), target::getSuspendListing, target::setSuspendListing)
                .set(in.issuedShare(), target::getIssuedShare, target::setIssuedShare)
                .set(in.qfiiSharesHeld(), target::getQfiiSharesHeld, target::setQfiiSharesHeld)
                .set(in.qfiiShareHoldingPercentage(), target::getQfiiShareHoldingPercentage,
                        target::setQfiiShareHoldingPercentage)
                .set(in.weight(), target::getWeight, target::setWeight)
                .changed();
    }

    public static boolean overwrite(StockIndex target, StockIndexRecord in) {
        return new Changes()
                .set(in.index(), target::getIndex, target::setIndex)
                .set(in.change(), target::getChange, target::setChange)
                .set(in.changeRange(), target::getChangeRange, target::setChangeRange)
                .set(in.tradeValue(), target::getTradeValue, target::setTradeValue)
                .set(in.tradingVolume(), target::getTradingVolume, target::setTradingVolume)
                .set(in.transaction(), target::getTransaction, target::setTransaction)
                .changed();
    }

    // ========== Monotonic Extremes ==========

    /**
     * A value with the date it was observed.
     */
    public record Extreme(double value, LocalDate date) {

        public static Extreme of(Double value, LocalDate date) {
            return new Extreme(value == null ? 0.0 : value, date);
        }

        public boolean isUnset() {
            return value == 0.0 || date == null;
        }
    }

    public static Extreme improveHigh(Extreme stored, Extreme candidate) {
        return improve(stored, candidate, true);
    }

    public static Extreme improveLow(Extreme stored, Extreme candidate) {
        return improve(stored, candidate, false);
    }

    private static Extreme improve(Extreme stored, Extreme candidate, boolean high) {
        if (candidate == null || candidate.isUnset()) {
            return stored;
        }
        if (stored == null || stored.isUnset()) {
            return candidate;
        }
        int cmp = Double.compare(candidate.value(), stored.value());
        if (cmp == 0) {
            return candidate.date().isBefore(stored.date()) ? candidate : stored;
        }
        boolean better = high ? cmp > 0 : cmp < 0;
        return better ? candidate : stored;
    }

    // ========== Cursor Gating ==========

    /**
     * @param cursor last applied period, {@code null} when nothing was applied yet
     */
    public static boolean cursorAllows(Long cursor, long period) {
        return cursor == null || period > cursor;
    }

    // ========== Helpers ==========

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Collects field assignments and remembers whether any of them changed a
     * stored value.
     */
    static final class Changes {

        private boolean changed;

        <T> Changes set(T incoming, Supplier<T> current, Consumer<T> setter) {
            if (incoming != null && !Objects.equals(incoming, current.get())) {
                setter.accept(incoming);
                changed = true;
            }
            return this;
        }

        boolean changed() {
            return changed;
        }
    }
}
