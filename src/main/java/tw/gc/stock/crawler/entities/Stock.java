package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Stock Entity - One listed, OTC or emerging security identified by its code.
 *
 * <p>Rows are never deleted. Delisting and trading halts only flip
 * {@code suspendListing}.</p>
 */
@Entity
@Table(name = "stocks", indexes = {
    @Index(name = "idx_stocks_market_industry", columnList = "stock_exchange_market_id, stock_industry_id"),
    @Index(name = "idx_stocks_industry", columnList = "stock_industry_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stock {

    /**
     * Security code (e.g., "2330")
     */
    @Id
    @Column(name = "stock_symbol", length = 24)
    private String stockSymbol;

    @Column(name = "name", nullable = false)
    @Builder.Default
    private String name = "";

    /**
     * Exchange market id (2 listed, 4 OTC, 5 emerging)
     */
    @Column(name = "stock_exchange_market_id", nullable = false)
    @Builder.Default
    private Integer stockExchangeMarketId = 0;

    @Column(name = "stock_industry_id", nullable = false)
    @Builder.Default
    private Integer stockIndustryId = 0;

    @Column(name = "suspend_listing", nullable = false)
    @Builder.Default
    private Boolean suspendListing = false;

    @Column(name = "issued_share", nullable = false)
    @Builder.Default
    private Long issuedShare = 0L;

    /**
     * Latest book value per share
     */
    @Column(name = "net_asset_value_per_share", nullable = false)
    @Builder.Default
    private Double netAssetValuePerShare = 0.0;

    @Column(name = "last_one_eps", nullable = false)
    @Builder.Default
    private Double lastOneEps = 0.0;

    /**
     * Trailing four quarters EPS
     */
    @Column(name = "last_four_eps", nullable = false)
    @Builder.Default
    private Double lastFourEps = 0.0;

    @Column(name = "return_on_equity", nullable = false)
    @Builder.Default
    private Double returnOnEquity = 0.0;

    /**
     * Shares held by qualified foreign institutional investors
     */
    @Column(name = "qfii_shares_held", nullable = false)
    @Builder.Default
    private Long qfiiSharesHeld = 0L;

    @Column(name = "qfii_share_holding_percentage", nullable = false)
    @Builder.Default
    private Double qfiiShareHoldingPercentage = 0.0;

    /**
     * Weight in the capitalization weighted index
     */
    @Column(name = "weight", nullable = false)
    @Builder.Default
    private Double weight = 0.0;

    @Column(name = "created_time", nullable = false, updatable = false)
    private LocalDateTime createdTime;

    @Column(name = "updated_time", nullable = false)
    private LocalDateTime updatedTime;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdTime = now;
        updatedTime = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedTime = LocalDateTime.now();
    }
}
