package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.FundMetricsSummary;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FundMetricsSummaryRepository extends JpaRepository<FundMetricsSummary, Long> {
}
