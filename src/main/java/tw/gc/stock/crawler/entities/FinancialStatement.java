package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * FinancialStatement Entity - Quarterly ({@code Q1}..{@code Q4}) or annual
 * ({@code ""}) statement figures of a security.
 */
@Entity
@Table(name = "financial_statement",
    uniqueConstraints = @UniqueConstraint(name = "uk_financial_statement_security_year_quarter",
        columnNames = {"security_code", "year", "quarter"}),
    indexes = {
        @Index(name = "idx_financial_statement_year_quarter", columnList = "year, quarter")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialStatement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "security_code", nullable = false, length = 24)
    private String securityCode;

    @Column(name = "year", nullable = false)
    private Integer year;

    @Column(name = "quarter", nullable = false, length = 4)
    @Builder.Default
    private String quarter = "";

    @Column(name = "gross_profit", nullable = false)
    @Builder.Default
    private Double grossProfit = 0.0;

    @Column(name = "operating_profit_margin", nullable = false)
    @Builder.Default
    private Double operatingProfitMargin = 0.0;

    @Column(name = "pre_tax_income", nullable = false)
    @Builder.Default
    private Double preTaxIncome = 0.0;

    @Column(name = "net_income", nullable = false)
    @Builder.Default
    private Double netIncome = 0.0;

    @Column(name = "net_asset_value_per_share", nullable = false)
    @Builder.Default
    private Double netAssetValuePerShare = 0.0;

    @Column(name = "sales_per_share", nullable = false)
    @Builder.Default
    private Double salesPerShare = 0.0;

    @Column(name = "earnings_per_share", nullable = false)
    @Builder.Default
    private Double earningsPerShare = 0.0;

    @Column(name = "profit_before_tax", nullable = false)
    @Builder.Default
    private Double profitBeforeTax = 0.0;

    @Column(name = "return_on_equity", nullable = false)
    @Builder.Default
    private Double returnOnEquity = 0.0;

    @Column(name = "return_on_assets", nullable = false)
    @Builder.Default
    private Double returnOnAssets = 0.0;

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

    public boolean isQuarterly() {
        return quarter != null && quarter.startsWith("Q");
    }
}
