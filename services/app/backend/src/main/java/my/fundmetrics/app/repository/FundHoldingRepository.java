package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.FundHolding;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FundHoldingRepository extends JpaRepository<FundHolding, Long> {
	List<FundHolding> findByFundId(Long fundId);
}
