package tw.gc.stock.crawler.sources.records;

import lombok.Builder;

import java.time.LocalDate;

@Builder(toBuilder = true)
public record StockIndexRecord(
        String category,
        LocalDate date,
        Double index,
        Double change,
        Double changeRange,
        Double tradeValue,
        Double tradingVolume,
        Double transaction
) implements NormalizedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.STOCK_INDEX;
    }

    @Override
    public String naturalKey() {
        return category + "@" + date;
    }

    @Override
    public String securityCode() {
        return null;
    }
}
