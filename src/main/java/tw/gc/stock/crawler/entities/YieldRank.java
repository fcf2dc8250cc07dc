package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * YieldRank Entity - Dividend yield of a security on a date together with the
 * quote and dividend rows it was computed from. The rank itself is derived on
 * read by ordering on {@code dividendYield}.
 */
@Entity
@Table(name = "yield_rank",
    uniqueConstraints = @UniqueConstraint(name = "uk_yield_rank_date_security",
        columnNames = {"date", "security_code"}),
    indexes = {
        @Index(name = "idx_yield_rank_security", columnList = "security_code")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class YieldRank {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    @Column(name = "daily_quote_id", nullable = false)
    private Long dailyQuoteId;

    @Column(name = "dividend_id", nullable = false)
    private Long dividendId;

    @Column(name = "yield", nullable = false)
    @Builder.Default
    private Double dividendYield = 0.0;

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
