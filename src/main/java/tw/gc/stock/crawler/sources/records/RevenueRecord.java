package tw.gc.stock.crawler.sources.records;

import lombok.Builder;

/**
 * Monthly revenue; {@code month} is {@code yyyyMM}.
 */
@Builder(toBuilder = true)
public record RevenueRecord(
        String securityCode,
        Long month,
        Double monthly,
        Double lastMonth,
        Double lastYearThisMonth,
        Double monthlyAccumulated,
        Double lastYearMonthlyAccumulated,
        Double comparedWithLastMonth,
        Double comparedWithLastYearSameMonth,
        Double accumulatedComparedWithLastYear
) implements NormalizedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.REVENUE;
    }

    @Override
    public String naturalKey() {
        return securityCode + "@" + month;
    }
}
