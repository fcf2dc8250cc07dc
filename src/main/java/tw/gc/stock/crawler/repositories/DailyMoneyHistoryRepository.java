package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.DailyMoneyHistory;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface DailyMoneyHistoryRepository extends JpaRepository<DailyMoneyHistory, Long> {

    Optional<DailyMoneyHistory> findByMemberIdAndDate(Long memberId, LocalDate date);

    /**
     * Latest snapshot strictly before {@code date}.
     */
    Optional<DailyMoneyHistory> findFirstByMemberIdAndDateLessThanOrderByDateDesc(Long memberId, LocalDate date);
}
