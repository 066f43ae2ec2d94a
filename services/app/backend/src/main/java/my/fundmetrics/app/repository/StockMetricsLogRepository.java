package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.StockMetricsLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface StockMetricsLogRepository extends JpaRepository<StockMetricsLog, Long> {
	List<StockMetricsLog> findByFundIdAndStockIdIn(Long fundId, Collection<Long> stockIds);

	List<StockMetricsLog> findByFundIdOrderByStockIdAscPeriodKeyDesc(Long fundId);
}
