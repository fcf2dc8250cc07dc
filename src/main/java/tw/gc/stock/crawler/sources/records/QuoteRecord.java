package tw.gc.stock.crawler.sources.records;

import lombok.Builder;

import java.time.LocalDate;

@Builder(toBuilder = true)
public record QuoteRecord(
        String securityCode,
        LocalDate date,
        Double openingPrice,
        Double highestPrice,
        Double lowestPrice,
        Double closingPrice,
        Double tradingVolume,
        Double transaction,
        Double tradeValue,
        Double change,
        Double changeRange,
        Double lastBestBidPrice,
        Double lastBestBidVolume,
        Double lastBestAskPrice,
        Double lastBestAskVolume,
        Double priceEarningRatio
) implements NormalizedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.QUOTE;
    }

    @Override
    public String naturalKey() {
        return securityCode + "@" + date;
    }
}
