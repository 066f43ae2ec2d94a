package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.PeriodRegistryEntry;
import my.fundmetrics.app.domain.PeriodRegistryEntryId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

public interface PeriodRegistryEntryRepository extends JpaRepository<PeriodRegistryEntry, PeriodRegistryEntryId> {
	@Modifying
	@Query(value = "insert into period_registry (category, period_key, period_kind, registered_at) "
			+ "values (:category, :periodKey, :periodKind, :registeredAt) "
			+ "on conflict (category, period_key) do nothing", nativeQuery = true)
	int insertIfAbsent(@Param("category") String category,
					   @Param("periodKey") String periodKey,
					   @Param("periodKind") String periodKind,
					   @Param("registeredAt") LocalDateTime registeredAt);
}
