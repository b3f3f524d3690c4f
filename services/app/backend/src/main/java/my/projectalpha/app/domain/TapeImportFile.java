package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "tape_import_files")
public class TapeImportFile {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "file_id")
	private Long fileId;

	@Column(name = "seller_id", nullable = false)
	private Long sellerId;

	@Column(name = "trade_id")
	private Long tradeId;

	@Column(name = "filename", nullable = false, length = 255)
	private String filename;

	@Column(name = "file_hash", nullable = false, length = 64)
	private String fileHash;

	@Column(name = "imported_at", nullable = false)
	private LocalDateTime importedAt;

	@Column(name = "status", nullable = false, length = 20)
	private String status;

	@Column(name = "rows_created", nullable = false)
	private int rowsCreated;

	@Column(name = "rows_updated", nullable = false)
	private int rowsUpdated;

	@Column(name = "rows_skipped", nullable = false)
	private int rowsSkipped;

	@Column(name = "error", length = 1000)
	private String error;

	public Long getFileId() {
		return fileId;
	}

	public void setFileId(Long fileId) {
		this.fileId = fileId;
	}

	public Long getSellerId() {
		return sellerId;
	}

	public void setSellerId(Long sellerId) {
		this.sellerId = sellerId;
	}

	public Long getTradeId() {
		return tradeId;
	}

	public void setTradeId(Long tradeId) {
		this.tradeId = tradeId;
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

	public LocalDateTime getImportedAt() {
		return importedAt;
	}

	public void setImportedAt(LocalDateTime importedAt) {
		this.importedAt = importedAt;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public int getRowsCreated() {
		return rowsCreated;
	}

	public void setRowsCreated(int rowsCreated) {
		this.rowsCreated = rowsCreated;
	}

	public int getRowsUpdated() {
		return rowsUpdated;
	}

	public void setRowsUpdated(int rowsUpdated) {
		this.rowsUpdated = rowsUpdated;
	}

	public int getRowsSkipped() {
		return rowsSkipped;
	}

	public void setRowsSkipped(int rowsSkipped) {
		this.rowsSkipped = rowsSkipped;
	}

	public String getError() {
		return error;
	}

	public void setError(String error) {
		this.error = error;
	}
}
