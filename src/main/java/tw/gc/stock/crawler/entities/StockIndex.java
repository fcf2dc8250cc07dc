package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * StockIndex Entity - Daily close of a market index (TAIEX, TPEx).
 */
@Entity
@Table(name = "stock_index",
    uniqueConstraints = @UniqueConstraint(name = "uk_stock_index_category_date",
        columnNames = {"category", "date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockIndex {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "category", nullable = false, length = 24)
    private String category;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "index_value", nullable = false)
    @Builder.Default
    private Double index = 0.0;

    @Column(name = "change", nullable = false)
    @Builder.Default
    private Double change = 0.0;

    @Column(name = "change_range", nullable = false)
    @Builder.Default
    private Double changeRange = 0.0;

    @Column(name = "trade_value", nullable = false)
    @Builder.Default
    private Double tradeValue = 0.0;

    @Column(name = "trading_volume", nullable = false)
    @Builder.Default
    private Double tradingVolume = 0.0;

    @Column(name = "transaction_count", nullable = false)
    @Builder.Default
    private Double transaction = 0.0;

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
