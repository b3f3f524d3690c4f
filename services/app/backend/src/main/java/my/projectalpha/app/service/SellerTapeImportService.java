package my.projectalpha.app.service;

import my.projectalpha.app.domain.AcqStatus;
import my.projectalpha.app.domain.AssetIdHub;
import my.projectalpha.app.domain.Seller;
import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.domain.TapeImportFile;
import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.dto.TapeImportResult;
import my.projectalpha.app.importer.SellerTape;
import my.projectalpha.app.importer.SellerTapeCsvParser;
import my.projectalpha.app.importer.SellerTapeRow;
import my.projectalpha.app.repository.SellerRawDataRepository;
import my.projectalpha.app.repository.SellerRepository;
import my.projectalpha.app.repository.TapeImportFileRepository;
import my.projectalpha.app.repository.TradeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Loads a seller loan tape into {@link SellerRawData}. Every new row gets its own asset hub; a file
 * already imported for the same seller is skipped unless a reimport is forced.
 */
@Service
public class SellerTapeImportService {
	private static final Logger logger = LoggerFactory.getLogger(SellerTapeImportService.class);
	static final String STATUS_IMPORTED = "imported";
	static final String STATUS_FAILED = "failed";
	static final String STATUS_SKIPPED = "skipped";
	static final String STATUS_DRY_RUN = "dry_run";

	private final SellerRepository sellerRepository;
	private final TradeRepository tradeRepository;
	private final SellerRawDataRepository rawDataRepository;
	private final TapeImportFileRepository importFileRepository;
	private final SellerService sellerService;
	private final TradeService tradeService;
	private final AssetService assetService;
	private final TransactionTemplate transactionTemplate;
	private final SellerTapeCsvParser parser = new SellerTapeCsvParser();

	public SellerTapeImportService(SellerRepository sellerRepository,
								   TradeRepository tradeRepository,
								   SellerRawDataRepository rawDataRepository,
								   TapeImportFileRepository importFileRepository,
								   SellerService sellerService,
								   TradeService tradeService,
								   AssetService assetService,
								   PlatformTransactionManager transactionManager) {
		this.sellerRepository = sellerRepository;
		this.tradeRepository = tradeRepository;
		this.rawDataRepository = rawDataRepository;
		this.importFileRepository = importFileRepository;
		this.sellerService = sellerService;
		this.tradeService = tradeService;
		this.assetService = assetService;
		this.transactionTemplate = new TransactionTemplate(transactionManager);
	}

	public TapeImportResult importTape(MultipartFile file, TapeImportOptions options) {
		String filename = file.getOriginalFilename() == null ? "upload.csv" : file.getOriginalFilename();
		if (!filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
			throw new IllegalArgumentException("Expected .csv file, got " + filename);
		}
		return importTape(readFile(file), filename, options);
	}

	public TapeImportResult importTape(byte[] payload, String filename, TapeImportOptions options) {
		if (options.tradeId() == null && isBlank(options.sellerName())) {
			throw new IllegalArgumentException("sellerName is required");
		}
		String fileHash = sha256(payload);
		SellerTape tape = parser.parse(payload, filename);
		List<TapeImportResult.RowErrorDto> errors = tape.errors().stream()
				.map(error -> new TapeImportResult.RowErrorDto(error.row(), error.message()))
				.toList();

		if (options.dryRun()) {
			Target target = resolveWithoutCreating(options);
			int existing = 0;
			if (target.trade() != null) {
				for (SellerTapeRow row : tape.rows()) {
					if (rawDataRepository.findByTradeIdAndSellertapeId(target.trade().getTradeId(), row.sellertapeId()).isPresent()) {
						existing += 1;
					}
				}
			}
			int created = tape.rows().size() - existing;
			int updated = options.updateExisting() ? existing : 0;
			int skipped = options.updateExisting() ? 0 : existing;
			return new TapeImportResult(target.sellerId(), target.tradeId(), STATUS_DRY_RUN, created, updated, skipped, errors);
		}

		Long[] sellerRef = new Long[1];
		Long[] tradeRef = new Long[1];
		try {
			return transactionTemplate.execute(status -> {
				Seller seller = resolveSeller(options);
				sellerRef[0] = seller == null ? null : seller.getSellerId();
				if (seller != null && !options.forceReimport()) {
					Optional<TapeImportFile> previous = importFileRepository.findFirstBySellerIdAndFileHashAndStatus(
							seller.getSellerId(), fileHash, STATUS_IMPORTED);
					if (previous.isPresent()) {
						logger.info("Tape {} already imported for seller {} (file {}); skipping.", filename,
								seller.getName(), previous.get().getFileId());
						return new TapeImportResult(seller.getSellerId(), previous.get().getTradeId(), STATUS_SKIPPED,
								0, 0, 0, List.of());
					}
				}
				Trade trade = resolveTrade(seller, options);
				tradeRef[0] = trade.getTradeId();
				Counts counts = saveRows(tape.rows(), trade, options.updateExisting());
				TapeImportFile record = newRecord(trade.getSellerId(), trade.getTradeId(), filename, fileHash, STATUS_IMPORTED);
				record.setRowsCreated(counts.created);
				record.setRowsUpdated(counts.updated);
				record.setRowsSkipped(counts.skipped);
				if (!errors.isEmpty()) {
					record.setError(truncate(errors.size() + " row error(s); first: row " + errors.get(0).row() + " "
							+ errors.get(0).message(), 1000));
				}
				importFileRepository.save(record);
				logger.info("Imported tape {} into trade {}: {} created, {} updated, {} skipped, {} error(s).", filename,
						trade.getTradeId(), counts.created, counts.updated, counts.skipped, errors.size());
				return new TapeImportResult(trade.getSellerId(), trade.getTradeId(), STATUS_IMPORTED, counts.created,
						counts.updated, counts.skipped, errors);
			});
		} catch (RuntimeException ex) {
			recordFailure(sellerRef[0], tradeRef[0], filename, fileHash, ex);
			throw ex;
		}
	}

	private Counts saveRows(List<SellerTapeRow> rows, Trade trade, boolean updateExisting) {
		Counts counts = new Counts();
		LocalDateTime now = LocalDateTime.now();
		for (SellerTapeRow row : rows) {
			Optional<SellerRawData> existing = rawDataRepository.findByTradeIdAndSellertapeId(trade.getTradeId(), row.sellertapeId());
			if (existing.isPresent()) {
				if (!updateExisting) {
					counts.skipped += 1;
					continue;
				}
				SellerRawData data = existing.get();
				row.applyTo(data);
				data.setUpdatedAt(now);
				rawDataRepository.save(data);
				counts.updated += 1;
				continue;
			}
			AssetIdHub hub = assetService.createHub(row.sellertapeId());
			SellerRawData data = new SellerRawData();
			data.setSellerId(trade.getSellerId());
			data.setTradeId(trade.getTradeId());
			data.setAssetHubId(hub.getAssetHubId());
			data.setAcqStatus(AcqStatus.KEEP);
			row.applyTo(data);
			data.setCreatedAt(now);
			data.setUpdatedAt(now);
			rawDataRepository.save(data);
			counts.created += 1;
		}
		return counts;
	}

	private Seller resolveSeller(TapeImportOptions options) {
		if (options.tradeId() != null) {
			Trade trade = tradeService.require(options.tradeId());
			return trade.getSellerId() == null ? null : sellerRepository.findById(trade.getSellerId()).orElse(null);
		}
		if (options.autoCreate()) {
			return sellerService.getOrCreate(options.sellerName());
		}
		return sellerRepository.findByName(options.sellerName().trim())
				.orElseThrow(() -> new IllegalArgumentException("Seller not found: " + options.sellerName()));
	}

	private Trade resolveTrade(Seller seller, TapeImportOptions options) {
		if (options.tradeId() != null) {
			return tradeService.require(options.tradeId());
		}
		if (options.autoCreate()) {
			return tradeService.createTrade(seller, options.tradeName());
		}
		return tradeRepository.findFirstBySellerIdOrderByCreatedAtDescTradeIdDesc(seller.getSellerId())
				.orElseThrow(() -> new IllegalArgumentException("Seller " + seller.getName() + " has no trades"));
	}

	private Target resolveWithoutCreating(TapeImportOptions options) {
		if (options.tradeId() != null) {
			Trade trade = tradeService.require(options.tradeId());
			return new Target(trade.getSellerId(), trade);
		}
		Optional<Seller> seller = sellerRepository.findByName(options.sellerName().trim());
		if (options.autoCreate()) {
			return new Target(seller.map(Seller::getSellerId).orElse(null), null);
		}
		Seller existing = seller.orElseThrow(() -> new IllegalArgumentException("Seller not found: " + options.sellerName()));
		Trade trade = tradeRepository.findFirstBySellerIdOrderByCreatedAtDescTradeIdDesc(existing.getSellerId())
				.orElseThrow(() -> new IllegalArgumentException("Seller " + existing.getName() + " has no trades"));
		return new Target(existing.getSellerId(), trade);
	}

	private void recordFailure(Long sellerId, Long tradeId, String filename, String fileHash, RuntimeException ex) {
		if (sellerId == null) {
			logger.warn("Tape import of {} failed before a seller was resolved: {}", filename, ex.getMessage());
			return;
		}
		try {
			transactionTemplate.executeWithoutResult(status -> {
				TapeImportFile record = newRecord(sellerId, tradeId, filename, fileHash, STATUS_FAILED);
				record.setError(truncate(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), 1000));
				importFileRepository.save(record);
			});
		} catch (RuntimeException recordEx) {
			logger.error("Could not record failed import of {}", filename, recordEx);
		}
		logger.warn("Tape import of {} failed: {}", filename, ex.getMessage());
	}

	private TapeImportFile newRecord(Long sellerId, Long tradeId, String filename, String fileHash, String status) {
		TapeImportFile record = new TapeImportFile();
		record.setSellerId(sellerId);
		record.setTradeId(tradeId);
		record.setFilename(truncate(filename, 255));
		record.setFileHash(fileHash);
		record.setImportedAt(LocalDateTime.now());
		record.setStatus(status);
		return record;
	}

	private byte[] readFile(MultipartFile file) {
		try {
			byte[] payload = file.getBytes();
			if (payload.length == 0) {
				throw new IllegalArgumentException("File is empty");
			}
			return payload;
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read upload: " + exc.getMessage(), exc);
		}
	}

	static String sha256(byte[] payload) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(payload));
		} catch (NoSuchAlgorithmException exc) {
			throw new IllegalStateException("SHA-256 not available", exc);
		}
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	private static String truncate(String value, int max) {
		return value == null || value.length() <= max ? value : value.substring(0, max);
	}

	private record Target(Long sellerId, Trade trade) {
		Long tradeId() {
			return trade == null ? null : trade.getTradeId();
		}
	}

	private static final class Counts {
		private int created;
		private int updated;
		private int skipped;
	}
}
