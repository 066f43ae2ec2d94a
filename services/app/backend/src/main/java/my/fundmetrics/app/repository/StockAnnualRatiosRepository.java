package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.StockAnnualRatios;
import my.fundmetrics.app.domain.StockPeriodId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface StockAnnualRatiosRepository extends JpaRepository<StockAnnualRatios, StockPeriodId> {
	List<StockAnnualRatios> findByIdStockIdIn(Collection<Long> stockIds);

	@Query(value = "select distinct period_key from stock_annual_ratios", nativeQuery = true)
	List<String> findDistinctPeriodKeys();
}
