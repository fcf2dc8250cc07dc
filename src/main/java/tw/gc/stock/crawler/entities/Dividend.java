package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Dividend Entity - Dividend declared for one fiscal period of a security.
 *
 * <h3>Period convention:</h3>
 * <ul>
 *   <li>{@code ""} - annual dividend</li>
 *   <li>{@code Q1}..{@code Q4} - quarterly dividend</li>
 *   <li>{@code H1}/{@code H2} - semi-annual dividend</li>
 * </ul>
 *
 * Cash and stock dividends are split into the part paid out of capital reserve
 * and the part paid out of earnings.
 */
@Entity
@Table(name = "dividend",
    uniqueConstraints = @UniqueConstraint(name = "uk_dividend_security_year_quarter",
        columnNames = {"security_code", "year", "quarter"}),
    indexes = {
        @Index(name = "idx_dividend_year_ex_dividend", columnList = "year, ex_dividend_date"),
        @Index(name = "idx_dividend_year_payable", columnList = "year, payable_date")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dividend {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    /**
     * Fiscal year the earnings belong to
     */
    @Column(name = "year", nullable = false)
    private Integer year;

    /**
     * Year the dividend is paid out
     */
    @Column(name = "year_of_dividend", nullable = false)
    @Builder.Default
    private Integer yearOfDividend = 0;

    @Column(name = "quarter", nullable = false, length = 4)
    @Builder.Default
    private String quarter = "";

    @Column(name = "cash_dividend", nullable = false)
    @Builder.Default
    private Double cashDividend = 0.0;

    @Column(name = "stock_dividend", nullable = false)
    @Builder.Default
    private Double stockDividend = 0.0;

    /**
     * Cash plus stock dividend
     */
    @Column(name = "sum", nullable = false)
    @Builder.Default
    private Double sum = 0.0;

    @Column(name = "capital_reserve_cash_dividend", nullable = false)
    @Builder.Default
    private Double capitalReserveCashDividend = 0.0;

    @Column(name = "earnings_cash_dividend", nullable = false)
    @Builder.Default
    private Double earningsCashDividend = 0.0;

    @Column(name = "capital_reserve_stock_dividend", nullable = false)
    @Builder.Default
    private Double capitalReserveStockDividend = 0.0;

    @Column(name = "earnings_stock_dividend", nullable = false)
    @Builder.Default
    private Double earningsStockDividend = 0.0;

    /**
     * Ex-dividend date of the cash dividend
     */
    @Column(name = "ex_dividend_date")
    private LocalDate exDividendDate;

    /**
     * Ex-rights date of the stock dividend
     */
    @Column(name = "ex_rights_date")
    private LocalDate exRightsDate;

    @Column(name = "payable_date")
    private LocalDate payableDate;

    @Column(name = "stock_payable_date")
    private LocalDate stockPayableDate;

    @Column(name = "payout_ratio_cash", nullable = false)
    @Builder.Default
    private Double payoutRatioCash = 0.0;

    @Column(name = "payout_ratio_stock", nullable = false)
    @Builder.Default
    private Double payoutRatioStock = 0.0;

    /**
     * Share of the period's earnings distributed, in percent
     */
    @Column(name = "payout_ratio", nullable = false)
    @Builder.Default
    private Double payoutRatio = 0.0;

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
