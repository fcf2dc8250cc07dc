package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * DailyMoneyHistory Entity - Mark-to-market snapshot of a member's holdings.
 *
 * <p>{@code cost} is signed negative, so {@code profitAndLoss = marketValue + cost}.
 * The {@code previousDay*} columns are copied from the latest snapshot strictly
 * before {@code date}, they are never recomputed.</p>
 */
@Entity
@Table(name = "daily_money_history",
    uniqueConstraints = @UniqueConstraint(name = "uk_daily_money_history_member_date",
        columnNames = {"member_id", "date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyMoneyHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "market_value", nullable = false)
    @Builder.Default
    private Double marketValue = 0.0;

    @Column(name = "cost", nullable = false)
    @Builder.Default
    private Double cost = 0.0;

    @Column(name = "profit_and_loss", nullable = false)
    @Builder.Default
    private Double profitAndLoss = 0.0;

    @Column(name = "profit_and_loss_percentage", nullable = false)
    @Builder.Default
    private Double profitAndLossPercentage = 0.0;

    @Column(name = "previous_day_market_value", nullable = false)
    @Builder.Default
    private Double previousDayMarketValue = 0.0;

    @Column(name = "previous_day_profit_and_loss", nullable = false)
    @Builder.Default
    private Double previousDayProfitAndLoss = 0.0;

    @Column(name = "previous_day_profit_and_loss_percentage", nullable = false)
    @Builder.Default
    private Double previousDayProfitAndLossPercentage = 0.0;

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
