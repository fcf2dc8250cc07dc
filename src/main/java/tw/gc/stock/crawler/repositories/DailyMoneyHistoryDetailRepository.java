package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.DailyMoneyHistoryDetail;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DailyMoneyHistoryDetailRepository extends JpaRepository<DailyMoneyHistoryDetail, Long> {

    List<DailyMoneyHistoryDetail> findByMemberIdAndDateOrderBySecurityCodeAsc(Long memberId, LocalDate date);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DailyMoneyHistoryDetail d WHERE d.memberId = :memberId AND d.date = :date")
    int deleteByMemberIdAndDate(@Param("memberId") Long memberId, @Param("date") LocalDate date);
}
