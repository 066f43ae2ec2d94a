package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.StockPeriodId;
import my.fundmetrics.app.domain.StockValuation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface StockValuationRepository extends JpaRepository<StockValuation, StockPeriodId> {
	List<StockValuation> findByIdStockIdIn(Collection<Long> stockIds);

	@Query(value = "select distinct period_key from stock_valuations", nativeQuery = true)
	List<String> findDistinctPeriodKeys();
}
