package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.MetricsCalculationSession;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MetricsCalculationSessionRepository extends JpaRepository<MetricsCalculationSession, String> {
}
