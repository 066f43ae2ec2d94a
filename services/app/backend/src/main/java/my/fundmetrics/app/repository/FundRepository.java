package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.Fund;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface FundRepository extends JpaRepository<Fund, Long> {
	Optional<Fund> findByFundCode(String fundCode);

	List<Fund> findByActiveTrueOrderByNameAsc();
}
