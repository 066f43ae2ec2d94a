package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.Stock;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface StockRepository extends JpaRepository<Stock, Long> {
	Optional<Stock> findByAccordCode(String accordCode);

	List<Stock> findByAccordCodeIn(Collection<String> accordCodes);

	List<Stock> findByIsinIn(Collection<String> isins);

	List<Stock> findAllByOrderByCompanyNameAsc();
}
