package tw.gc.stock.crawler.sources.records;

/**
 * Entity kinds a source can deliver, with the record type each one maps to.
 */
public enum RecordKind {
    QUOTE(QuoteRecord.class),
    DIVIDEND(DividendRecord.class),
    FINANCIAL_STATEMENT(FinancialStatementRecord.class),
    REVENUE(RevenueRecord.class),
    SECURITY_INFO(SecurityInfoRecord.class),
    STOCK_INDEX(StockIndexRecord.class);

    private final Class<? extends NormalizedRecord> recordType;

    RecordKind(Class<? extends NormalizedRecord> recordType) {
        this.recordType = recordType;
    }

    public Class<? extends NormalizedRecord> recordType() {
        return recordType;
    }
}
