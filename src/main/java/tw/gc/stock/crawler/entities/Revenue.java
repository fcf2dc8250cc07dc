package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Revenue Entity - Monthly revenue report of a security.
 *
 * <p>{@code month} is encoded as {@code yyyyMM} (e.g., 202403).</p>
 */
@Entity
@Table(name = "revenue",
    uniqueConstraints = @UniqueConstraint(name = "uk_revenue_security_month",
        columnNames = {"security_code", "month"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Revenue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    @Column(name = "month", nullable = false)
    private Long month;

    @Column(name = "monthly", nullable = false)
    @Builder.Default
    private Double monthly = 0.0;

    @Column(name = "last_month", nullable = false)
    @Builder.Default
    private Double lastMonth = 0.0;

    @Column(name = "last_year_this_month", nullable = false)
    @Builder.Default
    private Double lastYearThisMonth = 0.0;

    @Column(name = "monthly_accumulated", nullable = false)
    @Builder.Default
    private Double monthlyAccumulated = 0.0;

    @Column(name = "last_year_monthly_accumulated", nullable = false)
    @Builder.Default
    private Double lastYearMonthlyAccumulated = 0.0;

    /**
     * Month over month change in percent
     */
    @Column(name = "compared_with_last_month", nullable = false)
    @Builder.Default
    private Double comparedWithLastMonth = 0.0;

    /**
     * Year over year change in percent
     */
    @Column(name = "compared_with_last_year_same_month", nullable = false)
    @Builder.Default
    private Double comparedWithLastYearSameMonth = 0.0;

    @Column(name = "accumulated_compared_with_last_year", nullable = false)
    @Builder.Default
    private Double accumulatedComparedWithLastYear = 0.0;

    // Closing price statistics of the month, filled from daily_quote on merge

    @Column(name = "avg_price", nullable = false)
    @Builder.Default
    private Double avgPrice = 0.0;

    @Column(name = "lowest_price", nullable = false)
    @Builder.Default
    private Double lowestPrice = 0.0;

    @Column(name = "highest_price", nullable = false)
    @Builder.Default
    private Double highestPrice = 0.0;

    @Column(name = "created_time", nullable = false, updatable = false)
    private LocalDateTime createdTime;

    @PrePersist
    protected void onCreate() {
        createdTime = LocalDateTime.now();
    }
}
