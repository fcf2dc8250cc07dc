package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * DailyQuote Entity - End-of-day quote of one security.
 *
 * <p>Exactly one row per (security, date). Source columns are written by the
 * upsert merger; moving averages, yearly extrema and price-to-book are derived
 * columns written by the metrics engine and may be recomputed in place.</p>
 */
@Entity
@Table(name = "daily_quote",
    uniqueConstraints = @UniqueConstraint(name = "uk_daily_quote_security_date",
        columnNames = {"security_code", "date"}),
    indexes = {
        @Index(name = "idx_daily_quote_date", columnList = "date")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyQuote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    // ========== Source Columns ==========

    @Column(name = "trading_volume", nullable = false)
    @Builder.Default
    private Double tradingVolume = 0.0;

    @Column(name = "transaction_count", nullable = false)
    @Builder.Default
    private Double transaction = 0.0;

    @Column(name = "trade_value", nullable = false)
    @Builder.Default
    private Double tradeValue = 0.0;

    @Column(name = "opening_price", nullable = false)
    @Builder.Default
    private Double openingPrice = 0.0;

    @Column(name = "highest_price", nullable = false)
    @Builder.Default
    private Double highestPrice = 0.0;

    @Column(name = "lowest_price", nullable = false)
    @Builder.Default
    private Double lowestPrice = 0.0;

    @Column(name = "closing_price", nullable = false)
    @Builder.Default
    private Double closingPrice = 0.0;

    /**
     * Price change against the previous close
     */
    @Column(name = "change", nullable = false)
    @Builder.Default
    private Double change = 0.0;

    /**
     * Price change in percent
     */
    @Column(name = "change_range", nullable = false)
    @Builder.Default
    private Double changeRange = 0.0;

    @Column(name = "last_best_bid_price", nullable = false)
    @Builder.Default
    private Double lastBestBidPrice = 0.0;

    @Column(name = "last_best_bid_volume", nullable = false)
    @Builder.Default
    private Double lastBestBidVolume = 0.0;

    @Column(name = "last_best_ask_price", nullable = false)
    @Builder.Default
    private Double lastBestAskPrice = 0.0;

    @Column(name = "last_best_ask_volume", nullable = false)
    @Builder.Default
    private Double lastBestAskVolume = 0.0;

    @Column(name = "price_earning_ratio", nullable = false)
    @Builder.Default
    private Double priceEarningRatio = 0.0;

    // ========== Derived Columns ==========

    @Column(name = "moving_average_5", nullable = false)
    @Builder.Default
    private Double movingAverage5 = 0.0;

    @Column(name = "moving_average_10", nullable = false)
    @Builder.Default
    private Double movingAverage10 = 0.0;

    @Column(name = "moving_average_20", nullable = false)
    @Builder.Default
    private Double movingAverage20 = 0.0;

    @Column(name = "moving_average_60", nullable = false)
    @Builder.Default
    private Double movingAverage60 = 0.0;

    @Column(name = "moving_average_120", nullable = false)
    @Builder.Default
    private Double movingAverage120 = 0.0;

    @Column(name = "moving_average_240", nullable = false)
    @Builder.Default
    private Double movingAverage240 = 0.0;

    @Column(name = "maximum_price_in_year", nullable = false)
    @Builder.Default
    private Double maximumPriceInYear = 0.0;

    @Column(name = "minimum_price_in_year", nullable = false)
    @Builder.Default
    private Double minimumPriceInYear = 0.0;

    @Column(name = "average_price_in_year", nullable = false)
    @Builder.Default
    private Double averagePriceInYear = 0.0;

    @Column(name = "maximum_price_in_year_date_on")
    private LocalDate maximumPriceInYearDateOn;

    @Column(name = "minimum_price_in_year_date_on")
    private LocalDate minimumPriceInYearDateOn;

    @Column(name = "price_to_book_ratio", nullable = false)
    @Builder.Default
    private Double priceToBookRatio = 0.0;

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
