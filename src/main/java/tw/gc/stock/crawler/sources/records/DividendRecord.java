package tw.gc.stock.crawler.sources.records;

import lombok.Builder;

import java.time.LocalDate;

@Builder(toBuilder = true)
public record DividendRecord(
        String securityCode,
        Integer year,
        String quarter,
        Integer yearOfDividend,
        Double cashDividend,
        Double stockDividend,
        Double capitalReserveCashDividend,
        Double earningsCashDividend,
        Double capitalReserveStockDividend,
        Double earningsStockDividend,
        LocalDate exDividendDate,
        LocalDate exRightsDate,
        LocalDate payableDate,
        LocalDate stockPayableDate,
        Double payoutRatioCash,
        Double payoutRatioStock,
        Double payoutRatio
) implements NormalizedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.DIVIDEND;
    }

    @Override
    public String naturalKey() {
        return securityCode + "@" + year + (quarter == null ? "" : quarter);
    }
}
