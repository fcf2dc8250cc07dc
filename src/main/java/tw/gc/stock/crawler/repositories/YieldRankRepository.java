package tw.gc.stock.crawler.repositories;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.YieldRank;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface YieldRankRepository extends JpaRepository<YieldRank, Long> {

    Optional<YieldRank> findByDateAndSecurityCode(LocalDate date, String securityCode);

    /**
     * Cross-sectional ranking of a date, highest yield first. Ties fall back to
     * the security code so the order is stable.
     */
    List<YieldRank> findByDateOrderByDividendYieldDescSecurityCodeAsc(LocalDate date, Pageable pageable);
}
