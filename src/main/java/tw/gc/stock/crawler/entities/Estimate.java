package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Estimate Entity - Cheap / fair / expensive price band of a security on a date.
 *
 * <h3>Estimators:</h3>
 * <ul>
 *   <li><b>price</b>: 20/50/80th percentile of historical closing prices</li>
 *   <li><b>dividend</b>: average annual dividend x 15/20/30 (~6.6%/5%/3.3% yield)</li>
 *   <li><b>eps</b>: trailing four quarters EPS x average payout ratio x 15/20/30</li>
 *   <li><b>pbr</b>: 20/50/80th percentile price-to-book x current book value per share</li>
 *   <li><b>per</b>: 10/50/80th percentile P/E x average annual EPS</li>
 * </ul>
 *
 * {@code cheap}/{@code fair}/{@code expensive} hold the weighted blend of the
 * five estimators and {@code percentage} the distance of the close from cheap,
 * measured in units of (fair - cheap), in percent.
 */
@Entity
@Table(name = "estimate",
    uniqueConstraints = @UniqueConstraint(name = "uk_estimate_security_date",
        columnNames = {"security_code", "date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Estimate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "closing_price", nullable = false)
    @Builder.Default
    private Double closingPrice = 0.0;

    @Column(name = "percentage", nullable = false)
    @Builder.Default
    private Double percentage = 0.0;

    @Column(name = "cheap", nullable = false)
    @Builder.Default
    private Double cheap = 0.0;

    @Column(name = "fair", nullable = false)
    @Builder.Default
    private Double fair = 0.0;

    @Column(name = "expensive", nullable = false)
    @Builder.Default
    private Double expensive = 0.0;

    @Column(name = "price_cheap", nullable = false)
    @Builder.Default
    private Double priceCheap = 0.0;

    @Column(name = "price_fair", nullable = false)
    @Builder.Default
    private Double priceFair = 0.0;

    @Column(name = "price_expensive", nullable = false)
    @Builder.Default
    private Double priceExpensive = 0.0;

    @Column(name = "dividend_cheap", nullable = false)
    @Builder.Default
    private Double dividendCheap = 0.0;

    @Column(name = "dividend_fair", nullable = false)
    @Builder.Default
    private Double dividendFair = 0.0;

    @Column(name = "dividend_expensive", nullable = false)
    @Builder.Default
    private Double dividendExpensive = 0.0;

    @Column(name = "eps_cheap", nullable = false)
    @Builder.Default
    private Double epsCheap = 0.0;

    @Column(name = "eps_fair", nullable = false)
    @Builder.Default
    private Double epsFair = 0.0;

    @Column(name = "eps_expensive", nullable = false)
    @Builder.Default
    private Double epsExpensive = 0.0;

    @Column(name = "pbr_cheap", nullable = false)
    @Builder.Default
    private Double pbrCheap = 0.0;

    @Column(name = "pbr_fair", nullable = false)
    @Builder.Default
    private Double pbrFair = 0.0;

    @Column(name = "pbr_expensive", nullable = false)
    @Builder.Default
    private Double pbrExpensive = 0.0;

    @Column(name = "per_cheap", nullable = false)
    @Builder.Default
    private Double perCheap = 0.0;

    @Column(name = "per_fair", nullable = false)
    @Builder.Default
    private Double perFair = 0.0;

    @Column(name = "per_expensive", nullable = false)
    @Builder.Default
    private Double perExpensive = 0.0;

    /**
     * Number of distinct years of quotes the percentiles were taken over
     */
    @Column(name = "year_count", nullable = false)
    @Builder.Default
    private Integer yearCount = 0;

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
