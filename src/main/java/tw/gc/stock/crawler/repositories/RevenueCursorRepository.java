package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.RevenueCursor;

@Repository
public interface RevenueCursorRepository extends JpaRepository<RevenueCursor, String> {
}
