package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.StockIndex;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface StockIndexRepository extends JpaRepository<StockIndex, Long> {

    Optional<StockIndex> findByCategoryAndDate(String category, LocalDate date);
}
