package tw.gc.stock.crawler.repositories;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.DailyQuote;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for end-of-day quotes.
 */
@Repository
public interface DailyQuoteRepository extends JpaRepository<DailyQuote, Long> {

    Optional<DailyQuote> findBySecurityCodeAndDate(String securityCode, LocalDate date);

    Optional<DailyQuote> findFirstBySecurityCodeAndDateLessThanEqualOrderByDateDesc(
        String securityCode, LocalDate date);

    /**
     * Most recent quotes up to and including {@code date}, newest first.
     * Page size bounds the window (e.g., 240 trading days).
     */
    List<DailyQuote> findBySecurityCodeAndDateLessThanEqualOrderByDateDesc(
        String securityCode, LocalDate date, Pageable pageable);

    List<DailyQuote> findBySecurityCodeAndDateBetweenOrderByDateAsc(
        String securityCode, LocalDate startDate, LocalDate endDate);

    /**
     * Latest quote row of each requested code.
     */
    @Query("SELECT q FROM DailyQuote q WHERE q.securityCode IN :codes " +
           "AND q.date = (SELECT MAX(l.date) FROM DailyQuote l WHERE l.securityCode = q.securityCode)")
    List<DailyQuote> findLatestBySecurityCodes(@Param("codes") Collection<String> codes);

    @Query("SELECT DISTINCT q.securityCode FROM DailyQuote q WHERE q.date = :date ORDER BY q.securityCode")
    List<String> findSecurityCodesByDate(@Param("date") LocalDate date);
}
