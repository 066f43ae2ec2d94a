package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.StockPeriodId;
import my.fundmetrics.app.domain.StockTtmFinancials;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface StockTtmFinancialsRepository extends JpaRepository<StockTtmFinancials, StockPeriodId> {
	List<StockTtmFinancials> findByIdStockIdIn(Collection<Long> stockIds);

	@Query(value = "select distinct period_key from stock_ttm_financials", nativeQuery = true)
	List<String> findDistinctPeriodKeys();
}
