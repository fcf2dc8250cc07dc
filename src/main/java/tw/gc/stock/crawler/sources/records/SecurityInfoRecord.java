package tw.gc.stock.crawler.sources.records;

import lombok.Builder;

/**
 * Security metadata correction. Each source fills only the fields it knows
 * (book value, foreign holdings, index weight, suspension...).
 */
@Builder(toBuilder = true)
public record SecurityInfoRecord(
        String securityCode,
        String name,
        Integer stockExchangeMarketId,
        Integer stockIndustryId,
        Double netAssetValuePerShare,
        Boolean suspendListing,
        Long issuedShare,
        Long qfiiSharesHeld,
        Double qfiiShareHoldingPercentage,
        Double weight
) implements NormalizedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.SECURITY_INFO;
    }

    @Override
    public String naturalKey() {
        return securityCode;
    }
}
