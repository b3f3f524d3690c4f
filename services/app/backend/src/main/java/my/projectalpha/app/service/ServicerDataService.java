package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetIdHub;
import my.projectalpha.app.domain.ServicerImportFile;
import my.projectalpha.app.domain.ServicerLoanData;
import my.projectalpha.app.dto.ServicerImportResult;
import my.projectalpha.app.dto.ServicerLoanDataDto;
import my.projectalpha.app.dto.TapeImportResult;
import my.projectalpha.app.importer.ServicerExtract;
import my.projectalpha.app.importer.ServicerExtractCsvParser;
import my.projectalpha.app.importer.ServicerExtractRow;
import my.projectalpha.app.repository.AssetIdHubRepository;
import my.projectalpha.app.repository.ServicerImportFileRepository;
import my.projectalpha.app.repository.ServicerLoanDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads monthly servicer extracts into {@link ServicerLoanData}. A row upserts the snapshot for its
 * loan number and reporting month and is linked to the asset hub carrying the same servicer id.
 * A file whose hash was already imported is skipped unless a reimport is forced.
 */
@Service
public class ServicerDataService {
	private static final Logger logger = LoggerFactory.getLogger(ServicerDataService.class);

	private final ServicerLoanDataRepository loanDataRepository;
	private final ServicerImportFileRepository importFileRepository;
	private final AssetIdHubRepository hubRepository;
	private final AssetService assetService;
	private final TransactionTemplate transactionTemplate;
	private final ServicerExtractCsvParser parser = new ServicerExtractCsvParser();

	public ServicerDataService(ServicerLoanDataRepository loanDataRepository,
							   ServicerImportFileRepository importFileRepository,
							   AssetIdHubRepository hubRepository,
							   AssetService assetService,
							   PlatformTransactionManager transactionManager) {
		this.loanDataRepository = loanDataRepository;
		this.importFileRepository = importFileRepository;
		this.hubRepository = hubRepository;
		this.assetService = assetService;
		this.transactionTemplate = new TransactionTemplate(transactionManager);
	}

	public List<ServicerLoanDataDto> list(Long assetHubId) {
		AssetIdHub hub = assetService.require(assetHubId);
		return loanDataRepository
				.findByAssetHubIdOrderByReportingYearDescReportingMonthDescServicerLoanDataIdDesc(hub.getAssetHubId())
				.stream()
				.map(ServicerLoanDataDto::from)
				.toList();
	}

	public ServicerImportResult importExtract(MultipartFile file, boolean dryRun, boolean forceReimport) {
		String filename = file.getOriginalFilename() == null ? "servicer.csv" : file.getOriginalFilename();
		if (!filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
			throw new IllegalArgumentException("Expected .csv file, got " + filename);
		}
		byte[] payload;
		try {
			payload = file.getBytes();
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read upload: " + exc.getMessage(), exc);
		}
		if (payload.length == 0) {
			throw new IllegalArgumentException("File is empty");
		}
		return importExtract(payload, filename, dryRun, forceReimport);
	}

	public ServicerImportResult importExtract(byte[] payload, String filename, boolean dryRun, boolean forceReimport) {
		String fileHash = SellerTapeImportService.sha256(payload);
		ServicerExtract extract = parser.parse(payload, filename);
		List<TapeImportResult.RowErrorDto> errors = extract.errors().stream()
				.map(error -> new TapeImportResult.RowErrorDto(error.row(), error.message()))
				.toList();

		if (dryRun) {
			Counts counts = new Counts();
			Map<String, Optional<AssetIdHub>> hubs = new HashMap<>();
			for (ServicerExtractRow row : extract.rows()) {
				boolean exists = loanDataRepository.findByServicerIdAndReportingYearAndReportingMonth(row.servicerId(),
						row.asOfDate().getYear(), row.asOfDate().getMonthValue()).isPresent();
				counts.count(exists, hubFor(row.servicerId(), hubs).isPresent());
			}
			return new ServicerImportResult(null, SellerTapeImportService.STATUS_DRY_RUN, counts.created, counts.updated,
					counts.unmatched, errors);
		}

		try {
			return transactionTemplate.execute(status -> {
				if (!forceReimport) {
					Optional<ServicerImportFile> previous = importFileRepository.findFirstByFileHashAndStatus(fileHash,
							SellerTapeImportService.STATUS_IMPORTED);
					if (previous.isPresent()) {
						logger.info("Servicer extract {} already imported (file {}); skipping.", filename,
								previous.get().getFileId());
						return new ServicerImportResult(previous.get().getFileId(), SellerTapeImportService.STATUS_SKIPPED,
								0, 0, 0, List.of());
					}
				}
				ServicerImportFile record = importFileRepository.save(
						newRecord(filename, fileHash, SellerTapeImportService.STATUS_IMPORTED));
				Counts counts = saveRows(extract.rows(), record.getFileId());
				record.setRowsCreated(counts.created);
				record.setRowsUpdated(counts.updated);
				record.setRowsUnmatched(counts.unmatched);
				if (!errors.isEmpty()) {
					record.setError(truncate(errors.size() + " row error(s); first: row " + errors.get(0).row() + " "
							+ errors.get(0).message(), 1000));
				}
				importFileRepository.save(record);
				logger.info("Imported servicer extract {}: {} created, {} updated, {} without asset hub, {} error(s).",
						filename, counts.created, counts.updated, counts.unmatched, errors.size());
				return new ServicerImportResult(record.getFileId(), SellerTapeImportService.STATUS_IMPORTED,
						counts.created, counts.updated, counts.unmatched, errors);
			});
		} catch (RuntimeException ex) {
			recordFailure(filename, fileHash, ex);
			throw ex;
		}
	}

	private Counts saveRows(List<ServicerExtractRow> rows, Long fileId) {
		Counts counts = new Counts();
		Map<String, Optional<AssetIdHub>> hubs = new HashMap<>();
		LocalDateTime now = LocalDateTime.now();
		for (ServicerExtractRow row : rows) {
			Optional<ServicerLoanData> existing = loanDataRepository.findByServicerIdAndReportingYearAndReportingMonth(
					row.servicerId(), row.asOfDate().getYear(), row.asOfDate().getMonthValue());
			Optional<AssetIdHub> hub = hubFor(row.servicerId(), hubs);
			ServicerLoanData data = existing.orElseGet(() -> {
				ServicerLoanData created = new ServicerLoanData();
				created.setCreatedAt(now);
				return created;
			});
			row.applyTo(data);
			// a snapshot keeps its hub even when the hub later changes servicer id
			hub.ifPresent(match -> data.setAssetHubId(match.getAssetHubId()));
			data.setImportFileId(fileId);
			data.setUpdatedAt(now);
			loanDataRepository.save(data);
			counts.count(existing.isPresent(), data.getAssetHubId() != null);
		}
		return counts;
	}

	private Optional<AssetIdHub> hubFor(String servicerId, Map<String, Optional<AssetIdHub>> cache) {
		return cache.computeIfAbsent(servicerId, hubRepository::findFirstByServicerIdOrderByAssetHubIdAsc);
	}

	private void recordFailure(String filename, String fileHash, RuntimeException ex) {
		try {
			transactionTemplate.executeWithoutResult(status -> {
				ServicerImportFile record = newRecord(filename, fileHash, SellerTapeImportService.STATUS_FAILED);
				record.setError(truncate(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), 1000));
				importFileRepository.save(record);
			});
		} catch (RuntimeException recordEx) {
			logger.error("Could not record failed servicer import of {}", filename, recordEx);
		}
		logger.warn("Servicer import of {} failed: {}", filename, ex.getMessage());
	}

	private ServicerImportFile newRecord(String filename, String fileHash, String status) {
		ServicerImportFile record = new ServicerImportFile();
		record.setFilename(truncate(filename, 255));
		record.setFileHash(fileHash);
		record.setImportedAt(LocalDateTime.now());
		record.setStatus(status);
		return record;
	}

	private static String truncate(String value, int max) {
		return value == null || value.length() <= max ? value : value.substring(0, max);
	}

	private static final class Counts {
		private int created;
		private int updated;
		private int unmatched;

		private void count(boolean existed, boolean matched) {
			if (existed) {
				updated += 1;
			} else {
				created += 1;
			}
			if (!matched) {
				unmatched += 1;
			}
		}
	}
}
