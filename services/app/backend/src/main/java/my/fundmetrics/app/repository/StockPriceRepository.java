package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.StockPeriodId;
import my.fundmetrics.app.domain.StockPrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface StockPriceRepository extends JpaRepository<StockPrice, StockPeriodId> {
	List<StockPrice> findByIdStockIdIn(Collection<Long> stockIds);

	@Query(value = "select distinct period_key from stock_prices", nativeQuery = true)
	List<String> findDistinctPeriodKeys();
}
