package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * QuoteHistoryRecord Entity - All-time price and price-to-book extremes of a
 * security. Values only ever move outward.
 */
@Entity
@Table(name = "quote_history_record")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteHistoryRecord {

    @Id
    @Column(name = "security_code", length = 24)
    private String securityCode;

    @Column(name = "maximum_price", nullable = false)
    @Builder.Default
    private Double maximumPrice = 0.0;

    @Column(name = "maximum_price_date_on")
    private LocalDate maximumPriceDateOn;

    @Column(name = "minimum_price", nullable = false)
    @Builder.Default
    private Double minimumPrice = 0.0;

    @Column(name = "minimum_price_date_on")
    private LocalDate minimumPriceDateOn;

    @Column(name = "maximum_price_to_book_ratio", nullable = false)
    @Builder.Default
    private Double maximumPriceToBookRatio = 0.0;

    @Column(name = "maximum_price_to_book_ratio_date_on")
    private LocalDate maximumPriceToBookRatioDateOn;

    @Column(name = "minimum_price_to_book_ratio", nullable = false)
    @Builder.Default
    private Double minimumPriceToBookRatio = 0.0;

    @Column(name = "minimum_price_to_book_ratio_date_on")
    private LocalDate minimumPriceToBookRatioDateOn;
}
