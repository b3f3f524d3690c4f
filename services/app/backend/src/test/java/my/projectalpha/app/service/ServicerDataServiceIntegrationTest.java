package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetIdHub;
import my.projectalpha.app.domain.ServicerImportFile;
import my.projectalpha.app.domain.ServicerLoanData;
import my.projectalpha.app.dto.ServicerImportResult;
import my.projectalpha.app.dto.ServicerLoanDataDto;
import my.projectalpha.app.repository.AssetIdHubRepository;
import my.projectalpha.app.repository.ServicerImportFileRepository;
import my.projectalpha.app.repository.ServicerLoanDataRepository;
import my.projectalpha.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = my.projectalpha.app.AppApplication.class)
@ActiveProfiles("test")
class ServicerDataServiceIntegrationTest {
	private static final String JWT_SECRET = UUID.randomUUID().toString();
	private static final String APRIL = """
			loan_number,as_of_date,current_balance,total_debt
			0007001,2024-04-30,1000,1200
			7002,2024-04-30,500,
			""";
	private static final String MAY = """
			loan_number,as_of_date,current_balance
			7001,2024-05-31,990
			""";

	@Autowired
	private ServicerDataService servicerDataService;

	@Autowired
	private AssetService assetService;

	@Autowired
	private AssetIdHubRepository hubRepository;

	@Autowired
	private ServicerLoanDataRepository loanDataRepository;

	@Autowired
	private ServicerImportFileRepository importFileRepository;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	private Long hubId;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@BeforeEach
	void setUp() {
		AssetIdHub hub = assetService.createHub("LN-7001");
		hub.setServicerId("7001");
		hubId = hubRepository.save(hub).getAssetHubId();
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void importLinksRowsToHubByServicerId() {
		ServicerImportResult result = servicerDataService.importExtract(bytes(APRIL), "april.csv", false, false);

		assertThat(result.status()).isEqualTo("imported");
		assertThat(result.created()).isEqualTo(2);
		assertThat(result.updated()).isZero();
		assertThat(result.unmatched()).isEqualTo(1);

		List<ServicerLoanDataDto> rows = servicerDataService.list(hubId);
		assertThat(rows).singleElement().satisfies(row -> {
			assertThat(row.servicerId()).isEqualTo("7001");
			assertThat(row.totalDebt()).isEqualByComparingTo("1200");
			assertThat(row.computedTotalDebt()).isEqualByComparingTo("1000");
		});
		ServicerLoanData orphan = loanDataRepository.findByServicerIdAndReportingYearAndReportingMonth("7002", 2024, 4)
				.orElseThrow();
		assertThat(orphan.getAssetHubId()).isNull();
		assertThat(orphan.getImportFileId()).isEqualTo(result.fileId());
	}

	@Test
	void sameFileIsSkippedUnlessForced() {
		ServicerImportResult first = servicerDataService.importExtract(bytes(APRIL), "april.csv", false, false);
		ServicerImportResult second = servicerDataService.importExtract(bytes(APRIL), "april-copy.csv", false, false);
		ServicerImportResult forced = servicerDataService.importExtract(bytes(APRIL), "april.csv", false, true);

		assertThat(second.status()).isEqualTo("skipped");
		assertThat(second.fileId()).isEqualTo(first.fileId());
		assertThat(forced.status()).isEqualTo("imported");
		assertThat(forced.created()).isZero();
		assertThat(forced.updated()).isEqualTo(2);
		assertThat(loanDataRepository.count()).isEqualTo(2);
		assertThat(importFileRepository.findAll()).extracting(ServicerImportFile::getStatus)
				.containsExactly("imported", "imported");
	}

	@Test
	void monthlySnapshotsAreListedNewestFirst() {
		servicerDataService.importExtract(bytes(APRIL), "april.csv", false, false);
		servicerDataService.importExtract(bytes(MAY), "may.csv", false, false);

		assertThat(servicerDataService.list(hubId)).extracting(ServicerLoanDataDto::reportingMonth)
				.containsExactly(5, 4);
	}

	@Test
	void dryRunCountsWithoutWriting() {
		servicerDataService.importExtract(bytes(APRIL), "april.csv", false, false);

		ServicerImportResult dryRun = servicerDataService.importExtract(bytes(APRIL + "7003,2024-04-30,1\n"), "april.csv",
				true, false);

		assertThat(dryRun.status()).isEqualTo("dry_run");
		assertThat(dryRun.fileId()).isNull();
		assertThat(dryRun.created()).isEqualTo(1);
		assertThat(dryRun.updated()).isEqualTo(2);
		assertThat(dryRun.unmatched()).isEqualTo(2);
		assertThat(loanDataRepository.count()).isEqualTo(2);
		assertThat(importFileRepository.count()).isEqualTo(1);
	}

	@Test
	void listRequiresKnownAsset() {
		assertThatThrownBy(() -> servicerDataService.list(hubId + 100)).isInstanceOf(NotFoundException.class);
		assertThatThrownBy(() -> servicerDataService.list(null)).isInstanceOf(IllegalArgumentException.class);
	}

	private static byte[] bytes(String csv) {
		return csv.getBytes(StandardCharsets.UTF_8);
	}
}
