package tw.gc.stock.crawler.services.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.stock.crawler.entities.DailyQuote;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("YearlyExtrema")
class YearlyExtremaTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    private static DailyQuote quote(int offset, double close) {
        return DailyQuote.builder()
                .securityCode("2330")
                .date(DAY.plusDays(offset))
                .closingPrice(close)
                .build();
    }

    @Test
    @DisplayName("should find highest, lowest and average close")
    void shouldFindExtremes() {
        YearlyExtrema extrema = YearlyExtrema.of(List.of(
                quote(3, 20.0), quote(2, 8.0), quote(1, 15.0), quote(0, 10.0)));

        assertThat(extrema.maximum()).isEqualTo(20.0);
        assertThat(extrema.maximumDate()).isEqualTo(DAY.plusDays(3));
        assertThat(extrema.minimum()).isEqualTo(8.0);
        assertThat(extrema.minimumDate()).isEqualTo(DAY.plusDays(2));
        assertThat(extrema.average()).isEqualTo(13.25);
    }

    @Test
    @DisplayName("should keep the earliest date on ties")
    void shouldKeepEarliestOnTie() {
        YearlyExtrema extrema = YearlyExtrema.of(List.of(
                quote(5, 12.0), quote(4, 9.0), quote(2, 12.0), quote(1, 9.0)));

        assertThat(extrema.maximumDate()).isEqualTo(DAY.plusDays(2));
        assertThat(extrema.minimumDate()).isEqualTo(DAY.plusDays(1));
    }

    @Test
    @DisplayName("should ignore days without a trade")
    void shouldIgnoreZeroCloses() {
        YearlyExtrema extrema = YearlyExtrema.of(List.of(quote(1, 0.0), quote(0, 11.0)));

        assertThat(extrema.minimum()).isEqualTo(11.0);
        assertThat(extrema.average()).isEqualTo(11.0);
    }

    @Test
    @DisplayName("should be empty without any traded day")
    void shouldBeEmpty() {
        assertThat(YearlyExtrema.of(List.of())).isEqualTo(YearlyExtrema.EMPTY);
        assertThat(YearlyExtrema.of(List.of(quote(0, 0.0)))).isEqualTo(YearlyExtrema.EMPTY);
    }

    @Test
    @DisplayName("should write the extremes onto the quote")
    void shouldApply() {
        DailyQuote target = quote(9, 14.0);

        YearlyExtrema.of(List.of(quote(1, 20.0), quote(0, 8.0))).applyTo(target);

        assertThat(target.getMaximumPriceInYear()).isEqualTo(20.0);
        assertThat(target.getMinimumPriceInYearDateOn()).isEqualTo(DAY);
        assertThat(target.getAveragePriceInYear()).isEqualTo(14.0);
    }
}
