package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.StockOwnershipDetail;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface StockOwnershipDetailRepository extends JpaRepository<StockOwnershipDetail, Long> {

    /**
     * Members holding at least one open lot, or a lot sold on or after
     * {@code soldSince}.
     */
    @Query("SELECT DISTINCT s.memberId FROM StockOwnershipDetail s WHERE s.date <= :date " +
           "AND (s.isSold = false OR s.soldDate >= :soldSince) ORDER BY s.memberId")
    List<Long> findMembersWithOpenOrRecentlyClosedLots(
        @Param("date") LocalDate date,
        @Param("soldSince") LocalDate soldSince);

    /**
     * Lots a member held at the end of {@code date}.
     */
    @Query("SELECT s FROM StockOwnershipDetail s WHERE s.memberId = :memberId AND s.date <= :date " +
           "AND (s.isSold = false OR s.soldDate > :date) ORDER BY s.securityCode, s.id")
    List<StockOwnershipDetail> findLotsHeldOn(
        @Param("memberId") Long memberId,
        @Param("date") LocalDate date);
}
