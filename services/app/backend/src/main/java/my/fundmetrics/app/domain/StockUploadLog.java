package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "stock_upload_logs")
public class StockUploadLog {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "upload_id")
	private Long uploadId;

	@Column(name = "filename", nullable = false)
	private String filename;

	@Column(name = "file_hash", nullable = false)
	private String fileHash;

	@Column(name = "status", nullable = false)
	private String status;

	@Column(name = "stocks_created")
	private Integer stocksCreated;

	@Column(name = "stocks_updated")
	private Integer stocksUpdated;

	@Column(name = "rows_skipped")
	private Integer rowsSkipped;

	@Column(name = "records_written")
	private Integer recordsWritten;

	@Column(name = "error")
	private String error;

	@Column(name = "uploaded_at", nullable = false)
	private LocalDateTime uploadedAt;

	public Long getUploadId() {
		return uploadId;
	}

	public void setUploadId(Long uploadId) {
		this.uploadId = uploadId;
	}

	public String getFilename() {
		return filename;
	}

	public void setFilename(String filename) {
		this.filename = filename;
	}

	public String getFileHash() {
		return fileHash;
	}

	public void setFileHash(String fileHash) {
		this.fileHash = fileHash;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public Integer getStocksCreated() {
		return stocksCreated;
	}

	public void setStocksCreated(Integer stocksCreated) {
		this.stocksCreated = stocksCreated;
	}

	public Integer getStocksUpdated() {
		return stocksUpdated;
	}

	public void setStocksUpdated(Integer stocksUpdated) {
		this.stocksUpdated = stocksUpdated;
	}

	public Integer getRowsSkipped() {
		return rowsSkipped;
	}

	public void setRowsSkipped(Integer rowsSkipped) {
		this.rowsSkipped = rowsSkipped;
	}

	public Integer getRecordsWritten() {
		return recordsWritten;
	}

	public void setRecordsWritten(Integer recordsWritten) {
		this.recordsWritten = recordsWritten;
	}

	public String getError() {
		return error;
	}

	public void setError(String error) {
		this.error = error;
	}

	public LocalDateTime getUploadedAt() {
		return uploadedAt;
	}

	public void setUploadedAt(LocalDateTime uploadedAt) {
		this.uploadedAt = uploadedAt;
	}
}
