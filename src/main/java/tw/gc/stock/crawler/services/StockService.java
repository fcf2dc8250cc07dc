package tw.gc.stock.crawler.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.services.merge.RecordValidationException;
import tw.gc.stock.crawler.services.merge.UpsertMerger;
import tw.gc.stock.crawler.sources.records.SecurityInfoRecord;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Request/reply operations exposed to API consumers.
 *
 * <h3>Operations:</h3>
 * <ul>
 *   <li>UpdateSecurityInfo - corrects a security's metadata through the upsert merger</li>
 *   <li>FetchCurrentQuotes - latest stored close, change and change range per code</li>
 *   <li>FetchHolidaySchedule - exchange holidays of a year</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StockService {

    private final UpsertMerger upsertMerger;
    private final DailyQuoteRepository dailyQuoteRepository;
    private final TaiwanMarketCalendar marketCalendar;

    public record SecurityInfoUpdate(
            String code,
            String name,
            Integer marketId,
            Integer industryId,
            Double bookValuePerShare,
            Boolean suspended
    ) {}

    public record CurrentQuote(String code, double price, double change, double changeRange) {}

    public record Holiday(LocalDate date, String reason) {}

    // ========== UpdateSecurityInfo ==========

    /**
     * @return a human readable result message
     * @throws RecordValidationException when the code is missing
     */
    public String updateSecurityInfo(SecurityInfoUpdate update) {
        String code = update.code() == null ? null : update.code().trim();
        if (code == null || code.isEmpty()) {
            throw new RecordValidationException("", "security code is required");
        }

        SecurityInfoRecord record = SecurityInfoRecord.builder()
                .securityCode(code)
                .name(update.name())
                .stockExchangeMarketId(update.marketId())
                .stockIndustryId(update.industryId())
                .netAssetValuePerShare(update.bookValuePerShare())
                .suspendListing(update.suspended())
                .build();

        UpsertMerger.Outcome outcome = upsertMerger.mergeOne(record);
        log.info("📝 Security info of {} {}", code, outcome == UpsertMerger.Outcome.APPLIED ? "updated" : "unchanged");
        return outcome == UpsertMerger.Outcome.APPLIED
                ? "security " + code + " updated"
                : "security " + code + " unchanged";
    }

    // ========== FetchCurrentQuotes ==========

    /**
     * Latest stored quote of each code, in request order. Codes without any
     * quote are left out.
     */
    @Transactional(readOnly = true)
    public List<CurrentQuote> fetchCurrentQuotes(Collection<String> codes) {
        Set<String> requested = codes.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (requested.isEmpty()) {
            return List.of();
        }

        Map<String, DailyQuote> latest = dailyQuoteRepository.findLatestBySecurityCodes(requested).stream()
                .collect(Collectors.toMap(DailyQuote::getSecurityCode, Function.identity(), (a, b) -> a));

        return requested.stream()
                .map(latest::get)
                .filter(Objects::nonNull)
                .map(q -> new CurrentQuote(q.getSecurityCode(), q.getClosingPrice(), q.getChange(), q.getChangeRange()))
                .toList();
    }

    // ========== FetchHolidaySchedule ==========

    @Transactional(readOnly = true)
    public List<Holiday> fetchHolidaySchedule(int year) {
        return marketCalendar.getHolidays(year).stream()
                .map(h -> new Holiday(h.getDate(), h.getReason()))
                .toList();
    }
}
