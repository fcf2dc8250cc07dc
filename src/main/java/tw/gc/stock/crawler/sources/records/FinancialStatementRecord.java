package tw.gc.stock.crawler.sources.records;

import lombok.Builder;

@Builder(toBuilder = true)
public record FinancialStatementRecord(
        String securityCode,
        Integer year,
        String quarter,
        Double grossProfit,
        Double operatingProfitMargin,
        Double preTaxIncome,
        Double netIncome,
        Double netAssetValuePerShare,
        Double salesPerShare,
        Double earningsPerShare,
        Double profitBeforeTax,
        Double returnOnEquity,
        Double returnOnAssets
) implements NormalizedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.FINANCIAL_STATEMENT;
    }

    @Override
    public String naturalKey() {
        return securityCode + "@" + year + (quarter == null ? "" : quarter);
    }
}
