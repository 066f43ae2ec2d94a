package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.StockPeriodId;
import my.fundmetrics.app.domain.StockQuarterlyFinancials;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface StockQuarterlyFinancialsRepository extends JpaRepository<StockQuarterlyFinancials, StockPeriodId> {
	List<StockQuarterlyFinancials> findByIdStockIdIn(Collection<Long> stockIds);

	@Query(value = "select distinct period_key from stock_quarterly_financials", nativeQuery = true)
	List<String> findDistinctPeriodKeys();
}
