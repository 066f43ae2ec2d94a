package my.fundmetrics.app.repository;

import my.fundmetrics.app.domain.StockUploadLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface StockUploadLogRepository extends JpaRepository<StockUploadLog, Long> {
	Optional<StockUploadLog> findFirstByFileHashAndStatus(String fileHash, String status);
}
