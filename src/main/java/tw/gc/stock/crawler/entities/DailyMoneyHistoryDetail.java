package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * DailyMoneyHistoryDetail Entity - A member's lots of one security aggregated
 * for one day.
 */
@Entity
@Table(name = "daily_money_history_detail",
    uniqueConstraints = @UniqueConstraint(name = "uk_money_history_detail_member_date_security",
        columnNames = {"member_id", "date", "security_code"}),
    indexes = {
        @Index(name = "idx_money_history_detail_security", columnList = "security_code")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyMoneyHistoryDetail {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    @Column(name = "closing_price", nullable = false)
    @Builder.Default
    private Double closingPrice = 0.0;

    @Column(name = "total_shares", nullable = false)
    @Builder.Default
    private Long totalShares = 0L;

    @Column(name = "cost", nullable = false)
    @Builder.Default
    private Double cost = 0.0;

    @Column(name = "average_unit_price_per_share", nullable = false)
    @Builder.Default
    private Double averageUnitPricePerShare = 0.0;

    @Column(name = "market_value", nullable = false)
    @Builder.Default
    private Double marketValue = 0.0;

    /**
     * Share of the member's total market value, in percent
     */
    @Column(name = "ratio", nullable = false)
    @Builder.Default
    private Double ratio = 0.0;

    @Column(name = "profit_and_loss", nullable = false)
    @Builder.Default
    private Double profitAndLoss = 0.0;

    @Column(name = "profit_and_loss_percentage", nullable = false)
    @Builder.Default
    private Double profitAndLossPercentage = 0.0;

    @Column(name = "created_time", nullable = false, updatable = false)
    private LocalDateTime createdTime;

    @PrePersist
    protected void onCreate() {
        createdTime = LocalDateTime.now();
    }
}
