package tw.gc.stock.crawler.services.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.Dividend;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.services.merge.MergeRules.Extreme;
import tw.gc.stock.crawler.sources.records.DividendRecord;
import tw.gc.stock.crawler.sources.records.QuoteRecord;
import tw.gc.stock.crawler.sources.records.SecurityInfoRecord;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MergeRules")
class MergeRulesTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Nested
    @DisplayName("Overwrite")
    class Overwrite {

        @Test
        @DisplayName("should replace non-null fields and keep the rest")
        void shouldOverwriteNonNullFields() {
            DailyQuote stored = DailyQuote.builder()
                    .securityCode("2330").date(DAY)
                    .openingPrice(500.0).closingPrice(505.0).tradingVolume(1000.0)
                    .build();
            QuoteRecord incoming = QuoteRecord.builder()
                    .securityCode("2330").date(DAY)
                    .closingPrice(510.0)
                    .build();

            boolean changed = MergeRules.overwrite(stored, incoming);

            assertThat(changed).isTrue();
            assertThat(stored.getClosingPrice()).isEqualTo(510.0);
            assertThat(stored.getOpeningPrice()).isEqualTo(500.0);
            assertThat(stored.getTradingVolume()).isEqualTo(1000.0);
        }

        @Test
        @DisplayName("should report no change for an identical record")
        void shouldDetectUnchanged() {
            DailyQuote stored = DailyQuote.builder().securityCode("2330").date(DAY).closingPrice(510.0).build();
            QuoteRecord incoming = QuoteRecord.builder().securityCode("2330").date(DAY).closingPrice(510.0).build();

            assertThat(MergeRules.overwrite(stored, incoming)).isFalse();
        }

        @Test
        @DisplayName("should recompute the dividend sum from cash and stock")
        void shouldRecomputeDividendSum() {
            Dividend stored = Dividend.builder().securityCode("2330").year(2023).stockDividend(0.5).build();

            MergeRules.overwrite(stored, DividendRecord.builder().cashDividend(3.0).build());

            assertThat(stored.getSum()).isEqualTo(3.5);
        }

        @Test
        @DisplayName("should not blank out a security name")
        void shouldIgnoreBlankName() {
            Stock stored = Stock.builder().stockSymbol("2330").name("TSMC").build();

            boolean changed = MergeRules.overwrite(stored, SecurityInfoRecord.builder()
                    .securityCode("2330").name("  ").build());

            assertThat(changed).isFalse();
            assertThat(stored.getName()).isEqualTo("TSMC");
        }
    }

    @Nested
    @DisplayName("Monotonic extremes")
    class MonotonicExtremes {

        @Test
        @DisplayName("should track highest and lowest over a close series")
        void shouldTrackSeries() {
            List<Double> closes = List.of(10.0, 15.0, 8.0, 20.0);
            Extreme high = Extreme.of(0.0, null);
            Extreme low = Extreme.of(0.0, null);

            for (int i = 0; i < closes.size(); i++) {
                Extreme candidate = Extreme.of(closes.get(i), DAY.plusDays(i));
                high = MergeRules.improveHigh(high, candidate);
                low = MergeRules.improveLow(low, candidate);
            }

            assertThat(high).isEqualTo(new Extreme(20.0, DAY.plusDays(3)));
            assertThat(low).isEqualTo(new Extreme(8.0, DAY.plusDays(2)));
        }

        @Test
        @DisplayName("should never regress when merged again out of order")
        void shouldBeMonotonic() {
            Extreme high = new Extreme(20.0, DAY.plusDays(3));

            high = MergeRules.improveHigh(high, Extreme.of(15.0, DAY.plusDays(1)));
            high = MergeRules.improveHigh(high, Extreme.of(0.0, DAY.plusDays(9)));

            assertThat(high).isEqualTo(new Extreme(20.0, DAY.plusDays(3)));
        }

        @Test
        @DisplayName("should keep the earlier date on ties")
        void shouldKeepEarlierDateOnTie() {
            Extreme stored = new Extreme(20.0, DAY.plusDays(3));

            assertThat(MergeRules.improveHigh(stored, Extreme.of(20.0, DAY))).isEqualTo(new Extreme(20.0, DAY));
            assertThat(MergeRules.improveLow(stored, Extreme.of(20.0, DAY.plusDays(5)))).isEqualTo(stored);
        }
    }

    @Test
    @DisplayName("cursor should only allow strictly later periods")
    void cursorGating() {
        assertThat(MergeRules.cursorAllows(null, 202401L)).isTrue();
        assertThat(MergeRules.cursorAllows(202401L, 202402L)).isTrue();
        assertThat(MergeRules.cursorAllows(202402L, 202402L)).isFalse();
        assertThat(MergeRules.cursorAllows(202402L, 202401L)).isFalse();
    }
}
