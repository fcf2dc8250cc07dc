package tw.gc.stock.crawler.services.metrics;

import tw.gc.stock.crawler.entities.Dividend;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Folds dividend rows into one total per year.
 *
 * <p>A year's annual row (quarter {@code ""}) is authoritative when its sum is
 * positive. Otherwise the interim rows of that year are added up. The row the
 * total came from is kept as provenance: the annual row, or the newest
 * interim row.</p>
 */
public final class AnnualDividends {

    private AnnualDividends() {
    }

    public record AnnualDividend(int year, double total, Dividend source) {}

    /**
     * Years with a positive total, ascending.
     */
    public static Map<Integer, AnnualDividend> byYear(List<Dividend> dividends) {
        Map<Integer, List<Dividend>> grouped = dividends.stream()
                .collect(Collectors.groupingBy(Dividend::getYear, TreeMap::new, Collectors.toList()));

        Map<Integer, AnnualDividend> result = new TreeMap<>();
        grouped.forEach((year, rows) -> fold(year, rows).ifPresent(annual -> result.put(year, annual)));
        return result;
    }

    /**
     * Latest year up to {@code maxYear} with a positive total.
     */
    public static Optional<AnnualDividend> latest(List<Dividend> dividends, int maxYear) {
        return byYear(dividends).values().stream()
                .filter(annual -> annual.year() <= maxYear)
                .max(Comparator.comparingInt(AnnualDividend::year));
    }

    private static Optional<AnnualDividend> fold(int year, List<Dividend> rows) {
        Optional<Dividend> annual = rows.stream()
                .filter(d -> d.getQuarter() == null || d.getQuarter().isEmpty())
                .filter(d -> d.getSum() > 0)
                .findFirst();
        if (annual.isPresent()) {
            return Optional.of(new AnnualDividend(year, annual.get().getSum(), annual.get()));
        }

        List<Dividend> interim = rows.stream()
                .filter(d -> d.getQuarter() != null && !d.getQuarter().isEmpty())
                .filter(d -> d.getSum() > 0)
                .toList();
        if (interim.isEmpty()) {
            return Optional.empty();
        }
        double total = interim.stream().mapToDouble(Dividend::getSum).sum();
        Dividend newest = interim.stream()
                .max(Comparator.comparing(Dividend::getQuarter).thenComparing(d -> d.getId() == null ? 0L : d.getId()))
                .orElseThrow();
        return Optional.of(new AnnualDividend(year, total, newest));
    }
}
