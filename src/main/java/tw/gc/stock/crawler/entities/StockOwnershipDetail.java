package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * StockOwnershipDetail Entity - One purchase lot of a member.
 */
@Entity
@Table(name = "stock_ownership_details", indexes = {
    @Index(name = "idx_ownership_security", columnList = "security_code"),
    @Index(name = "idx_ownership_member", columnList = "member_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockOwnershipDetail {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    @Column(name = "share_quantity", nullable = false)
    @Builder.Default
    private Long shareQuantity = 0L;

    /**
     * Total purchase cost of the lot, fees included
     */
    @Column(name = "holding_cost", nullable = false)
    @Builder.Default
    private Double holdingCost = 0.0;

    @Column(name = "share_price_average", nullable = false)
    @Builder.Default
    private Double sharePriceAverage = 0.0;

    @Column(name = "is_sold", nullable = false)
    @Builder.Default
    private Boolean isSold = false;

    /**
     * Date the lot was sold, when {@code isSold}
     */
    @Column(name = "sold_date")
    private LocalDate soldDate;

    @Column(name = "cumulate_dividends_cash", nullable = false)
    @Builder.Default
    private Double cumulateDividendsCash = 0.0;

    @Column(name = "cumulate_dividends_stock", nullable = false)
    @Builder.Default
    private Double cumulateDividendsStock = 0.0;

    @Column(name = "cumulate_dividends_total", nullable = false)
    @Builder.Default
    private Double cumulateDividendsTotal = 0.0;

    /**
     * Purchase date
     */
    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "created_time", nullable = false, updatable = false)
    private LocalDateTime createdTime;

    @PrePersist
    protected void onCreate() {
        createdTime = LocalDateTime.now();
    }

    /**
     * Unit cost per share, derived from the holding cost when the average price
     * was not recorded.
     */
    public double unitCost() {
        if (sharePriceAverage != null && sharePriceAverage > 0) {
            return sharePriceAverage;
        }
        if (shareQuantity == null || shareQuantity == 0 || holdingCost == null) {
            return 0.0;
        }
        return Math.abs(holdingCost) / shareQuantity;
    }
}
