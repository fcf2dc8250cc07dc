package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.Dividend;

import java.util.List;
import java.util.Optional;

@Repository
public interface DividendRepository extends JpaRepository<Dividend, Long> {

    Optional<Dividend> findBySecurityCodeAndYearAndQuarter(String securityCode, Integer year, String quarter);

    List<Dividend> findBySecurityCodeAndYearBetweenOrderByYearAscQuarterAsc(
        String securityCode, Integer fromYear, Integer toYear);
}
