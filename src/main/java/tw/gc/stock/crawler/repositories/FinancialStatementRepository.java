package tw.gc.stock.crawler.repositories;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.FinancialStatement;

import java.util.List;
import java.util.Optional;

@Repository
public interface FinancialStatementRepository extends JpaRepository<FinancialStatement, Long> {

    Optional<FinancialStatement> findBySecurityCodeAndYearAndQuarter(
        String securityCode, Integer year, String quarter);

    /**
     * Quarterly statements, newest first.
     */
    @Query("SELECT f FROM FinancialStatement f WHERE f.securityCode = :code " +
           "AND f.quarter LIKE 'Q%' ORDER BY f.year DESC, f.quarter DESC")
    List<FinancialStatement> findLatestQuarters(@Param("code") String securityCode, Pageable pageable);

    @Query("SELECT f FROM FinancialStatement f WHERE f.securityCode = :code " +
           "AND f.quarter LIKE 'Q%' AND f.year BETWEEN :fromYear AND :toYear ORDER BY f.year, f.quarter")
    List<FinancialStatement> findQuartersBetween(
        @Param("code") String securityCode,
        @Param("fromYear") Integer fromYear,
        @Param("toYear") Integer toYear);
}
