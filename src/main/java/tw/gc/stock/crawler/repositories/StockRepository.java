package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.Stock;

import java.util.List;

@Repository
public interface StockRepository extends JpaRepository<Stock, String> {

    List<Stock> findBySuspendListingFalseOrderByStockSymbolAsc();

    List<Stock> findByStockExchangeMarketIdAndSuspendListingFalseOrderByStockSymbolAsc(Integer marketId);
}
