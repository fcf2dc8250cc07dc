package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.Estimate;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface EstimateRepository extends JpaRepository<Estimate, Long> {

    Optional<Estimate> findBySecurityCodeAndDate(String securityCode, LocalDate date);

    Optional<Estimate> findFirstBySecurityCodeOrderByDateDesc(String securityCode);
}
