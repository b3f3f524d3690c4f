package my.projectalpha.app.service;

import my.projectalpha.app.domain.AcqStatus;
import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.domain.TapeImportFile;
import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.domain.TradeStatus;
import my.projectalpha.app.dto.AcqStatusUpdateDto;
import my.projectalpha.app.dto.TapeImportResult;
import my.projectalpha.app.repository.AssetIdHubRepository;
import my.projectalpha.app.repository.SellerRawDataRepository;
import my.projectalpha.app.repository.SellerRepository;
import my.projectalpha.app.repository.TapeImportFileRepository;
import my.projectalpha.app.repository.TradeRepository;
import my.projectalpha.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = my.projectalpha.app.AppApplication.class)
@ActiveProfiles("test")
class SellerTapeImportServiceIntegrationTest {
	private static final String JWT_SECRET = UUID.randomUUID().toString();

	@Autowired
	private SellerTapeImportService importService;

	@Autowired
	private SellerService sellerService;

	@Autowired
	private AcqAssetService acqAssetService;

	@Autowired
	private SellerRepository sellerRepository;

	@Autowired
	private TradeRepository tradeRepository;

	@Autowired
	private SellerRawDataRepository rawDataRepository;

	@Autowired
	private AssetIdHubRepository hubRepository;

	@Autowired
	private TapeImportFileRepository importFileRepository;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void importCreatesSellerTradeAndRows() throws IOException {
		TapeImportResult result = importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions("Acme Capital", null, "Pool A", true, false, false, false));

		assertThat(result.status()).isEqualTo(SellerTapeImportService.STATUS_IMPORTED);
		assertThat(result.created()).isEqualTo(3);
		assertThat(result.errors()).extracting(TapeImportResult.RowErrorDto::row).containsExactly(4);

		Trade trade = tradeRepository.findById(result.tradeId()).orElseThrow();
		assertThat(trade.getTradeName()).isEqualTo("Pool A");
		assertThat(trade.getStatus()).isEqualTo(TradeStatus.INDICATIVE);
		assertThat(trade.getSellerId()).isEqualTo(result.sellerId());

		List<SellerRawData> rows = rawDataRepository.findByTradeIdOrderBySellertapeIdAsc(trade.getTradeId());
		assertThat(rows).extracting(SellerRawData::getSellertapeId).containsExactly("LN-1001", "LN-1002", "LN-1003");
		assertThat(rows).allSatisfy(row -> {
			assertThat(row.getAcqStatus()).isEqualTo(AcqStatus.KEEP);
			assertThat(row.getAssetHubId()).isNotNull();
		});
		assertThat(hubRepository.count()).isEqualTo(3);

		TapeImportFile record = importFileRepository.findAll().get(0);
		assertThat(record.getStatus()).isEqualTo(SellerTapeImportService.STATUS_IMPORTED);
		assertThat(record.getRowsCreated()).isEqualTo(3);
		assertThat(record.getError()).contains("1 row error(s)");
	}

	@Test
	void sameFileIsSkippedForSameSeller() throws IOException {
		TapeImportOptions options = new TapeImportOptions("Acme Capital", null, "Pool A", true, false, false, false);
		TapeImportResult first = importService.importTape(fixture(), "seller-tape.csv", options);

		TapeImportResult second = importService.importTape(fixture(), "renamed.csv", options);

		assertThat(second.status()).isEqualTo(SellerTapeImportService.STATUS_SKIPPED);
		assertThat(second.tradeId()).isEqualTo(first.tradeId());
		assertThat(tradeRepository.count()).isEqualTo(1);
		assertThat(rawDataRepository.count()).isEqualTo(3);
	}

	@Test
	void forcedReimportIntoTradeUpdatesOrSkipsExistingRows() throws IOException {
		TapeImportResult first = importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions("Acme Capital", null, null, true, false, false, false));

		TapeImportResult skipped = importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions(null, first.tradeId(), null, false, false, false, true));
		TapeImportResult updated = importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions(null, first.tradeId(), null, false, true, false, true));

		assertThat(skipped.skipped()).isEqualTo(3);
		assertThat(skipped.created()).isZero();
		assertThat(updated.updated()).isEqualTo(3);
		assertThat(rawDataRepository.count()).isEqualTo(3);
		assertThat(hubRepository.count()).isEqualTo(3);
		assertThat(tradeRepository.findById(first.tradeId()).orElseThrow().getTradeName()).startsWith("AcmeCapital - ");
	}

	@Test
	void dryRunWritesNothing() throws IOException {
		TapeImportResult result = importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions("New Seller", null, null, true, false, true, false));

		assertThat(result.status()).isEqualTo(SellerTapeImportService.STATUS_DRY_RUN);
		assertThat(result.created()).isEqualTo(3);
		assertThat(result.sellerId()).isNull();
		assertThat(sellerRepository.count()).isZero();
		assertThat(importFileRepository.count()).isZero();
	}

	@Test
	void failedImportIsRecorded() throws IOException {
		sellerService.getOrCreate("Lonely Seller");

		assertThatThrownBy(() -> importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions("Lonely Seller", null, null, false, false, false, false)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("has no trades");

		assertThat(rawDataRepository.count()).isZero();
		assertThat(importFileRepository.findAll()).singleElement().satisfies(record -> {
			assertThat(record.getStatus()).isEqualTo(SellerTapeImportService.STATUS_FAILED);
			assertThat(record.getError()).contains("has no trades");
		});
	}

	@Test
	void unknownSellerWithoutAutoCreateIsRejected() {
		assertThatThrownBy(() -> importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions("Nobody", null, null, false, false, false, false)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Seller not found: Nobody");
		assertThat(importFileRepository.count()).isZero();
	}

	@Test
	void droppingLastKeptRowPassesTrade() throws IOException {
		TapeImportResult imported = importService.importTape(fixture(), "seller-tape.csv",
				new TapeImportOptions("Acme Capital", null, null, true, false, false, false));
		List<SellerRawData> rows = rawDataRepository.findByTradeIdOrderBySellertapeIdAsc(imported.tradeId());

		AcqStatusUpdateDto firstDrop = acqAssetService.setAcqStatus(rows.get(0).getSellerRawDataId(), "drop");
		acqAssetService.setAcqStatus(rows.get(1).getSellerRawDataId(), "DROP");
		AcqStatusUpdateDto lastDrop = acqAssetService.setAcqStatus(rows.get(2).getSellerRawDataId(), "drop");

		assertThat(firstDrop.tradeStatusChanged()).isFalse();
		assertThat(firstDrop.tradeStatus()).isEqualTo("INDICATIVE");
		assertThat(lastDrop.tradeStatusChanged()).isTrue();
		assertThat(lastDrop.tradeStatus()).isEqualTo("PASS");
		assertThat(acqAssetService.listForTrade(imported.tradeId(), "keep")).isEmpty();
		assertThat(acqAssetService.listForTrade(imported.tradeId(), null)).hasSize(3);
	}

	private byte[] fixture() throws IOException {
		try (InputStream input = getClass().getResourceAsStream("/fixtures/seller-tape.csv")) {
			return input.readAllBytes();
		}
	}
}
