package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetIdHub;
import my.projectalpha.app.domain.AssetStatus;
import my.projectalpha.app.dto.MilestoneDto;
import my.projectalpha.app.dto.OutcomeAuditDto;
import my.projectalpha.app.dto.OutcomeDto;
import my.projectalpha.app.dto.OutcomeTaskDto;
import my.projectalpha.app.dto.OutcomeTaskRequest;
import my.projectalpha.app.dto.TaskMetricsDto;
import my.projectalpha.app.repository.AssetIdHubRepository;
import my.projectalpha.app.repository.OutcomeTaskRepository;
import my.projectalpha.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = my.projectalpha.app.AppApplication.class)
@ActiveProfiles("test")
class OutcomeServiceIntegrationTest {
	private static final String JWT_SECRET = UUID.randomUUID().toString();

	@Autowired
	private OutcomeService outcomeService;

	@Autowired
	private OutcomeTaskService taskService;

	@Autowired
	private OutcomeAuditService auditService;

	@Autowired
	private TaskMetricsService metricsService;

	@Autowired
	private AssetIdHubRepository hubRepository;

	@Autowired
	private OutcomeTaskRepository taskRepository;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	private Long assetHubId;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@BeforeEach
	void setUp() {
		AssetIdHub hub = new AssetIdHub();
		hub.setSellertapeId("LN-1001");
		hub.setAssetStatus(AssetStatus.ACTIVE);
		hub.setCreatedAt(LocalDateTime.now());
		hub.setUpdatedAt(LocalDateTime.now());
		assetHubId = hubRepository.save(hub).getAssetHubId();
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void ensureCreatesOnceAndAuditsInitialFields() {
		Map<String, Object> body = new HashMap<>();
		body.put("asset_hub_id", assetHubId);
		body.put("outcome_type", "reo");
		body.put("list_price", "125000");
		body.put("purchase_type", "Cash");

		OutcomeDto created = outcomeService.ensure(body, "analyst");
		OutcomeDto again = outcomeService.ensure(Map.of("assetHubId", assetHubId, "outcomeType", "REO"), "analyst");

		assertThat(again.id()).isEqualTo(created.id());
		assertThat(created.outcomeType()).isEqualTo("REO");
		assertThat((BigDecimal) created.fields().get("list_price")).isEqualByComparingTo("125000");
		assertThat(created.fields().get("purchase_type")).isEqualTo("cash");
		assertThat(created.fields()).containsKey("contract_price").doesNotContainKey("fc_bid_price");

		List<OutcomeAuditDto> audit = auditService.list(assetHubId);
		assertThat(audit).hasSize(3);
		assertThat(audit).extracting(OutcomeAuditDto::source).containsOnly("create");
		assertThat(audit).extracting(OutcomeAuditDto::field).contains("outcome", "list_price", "purchase_type");
		assertThat(audit).extracting(OutcomeAuditDto::editedBy).containsOnly("analyst");
	}

	@Test
	void ensureRejectsUnknownAsset() {
		assertThatThrownBy(() -> outcomeService.ensure(Map.of("assetHubId", assetHubId + 100, "outcomeType", "fc"), null))
				.isInstanceOf(NotFoundException.class);
	}

	@Test
	void updateAuditsOnlyChangedFields() {
		OutcomeDto outcome = outcomeService.ensure(
				Map.of("assetHubId", assetHubId, "outcomeType", "fc", "fc_bid_price", "90000"), "analyst");

		OutcomeDto updated = outcomeService.update(outcome.id(),
				Map.of("fc_bid_price", "90000.00", "fc_sale_scheduled_date", "2024-05-01"), "");

		assertThat(updated.fields().get("fc_sale_scheduled_date")).isEqualTo(LocalDate.of(2024, 5, 1));
		List<OutcomeAuditDto> updates = auditService.list(assetHubId).stream()
				.filter(entry -> entry.source().equals("update"))
				.toList();
		assertThat(updates).singleElement().satisfies(entry -> {
			assertThat(entry.field()).isEqualTo("fc_sale_scheduled_date");
			assertThat(entry.oldValue()).isNull();
			assertThat(entry.newValue()).isEqualTo("2024-05-01");
			assertThat(entry.editedBy()).isEqualTo("system");
		});
	}

	@Test
	void updateRejectsForeignFieldsAndInvalidChoices() {
		OutcomeDto reo = outcomeService.ensure(Map.of("assetHubId", assetHubId, "outcomeType", "reo"), null);

		assertThatThrownBy(() -> outcomeService.update(reo.id(), Map.of("dil_cost", "10"), null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("does not apply to REO outcomes");
		assertThatThrownBy(() -> outcomeService.update(reo.id(), Map.of("purchase_type", "barter"), null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid value for purchase_type");
		assertThatThrownBy(() -> outcomeService.update(reo.id(), Map.of("list_price", "lots"), null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid value for list_price");
	}

	@Test
	void tasksAreValidatedPerOutcomeType() {
		OutcomeDto dil = outcomeService.ensure(Map.of("assetHubId", assetHubId, "outcomeType", "dil"), null);

		OutcomeTaskDto task = taskService.create(new OutcomeTaskRequest(dil.id(), "pursuing_dil", null, "Letter sent"));

		assertThat(task.taskStarted()).isEqualTo(LocalDate.now());
		assertThat(task.taskLabel()).isEqualTo("Pursuing DIL");
		assertThat(task.outcomeType()).isEqualTo("DIL");
		assertThatThrownBy(() -> taskService.create(new OutcomeTaskRequest(dil.id(), "eviction", null, null)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("not valid for DIL outcomes");
		assertThatThrownBy(() -> taskService.create(new OutcomeTaskRequest(dil.id(), "pursuing_dil", null, null)))
				.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> taskService.update(task.id(), new OutcomeTaskRequest(null, "dil_drafted", null, null)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("taskType cannot be changed");
		assertThatThrownBy(() -> taskService.list(null, null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void milestonesFollowTaskOrder() {
		OutcomeDto reo = outcomeService.ensure(Map.of("assetHubId", assetHubId, "outcomeType", "reo"), null);
		assertThat(taskService.milestones(reo.id())).isEqualTo(new MilestoneDto("REO", null, null));

		taskService.create(new OutcomeTaskRequest(reo.id(), "renovation", LocalDate.of(2024, 1, 10), null));
		taskService.create(new OutcomeTaskRequest(reo.id(), "eviction", LocalDate.of(2024, 2, 1), null));

		assertThat(taskService.milestones(reo.id())).isEqualTo(new MilestoneDto("REO", "renovation", "pre_marketing"));

		taskService.create(new OutcomeTaskRequest(reo.id(), "sold", LocalDate.of(2024, 6, 1), null));
		assertThat(taskService.milestones(reo.id())).isEqualTo(new MilestoneDto("REO", "sold", null));
		assertThat(taskService.list(assetHubId, null)).extracting(OutcomeTaskDto::taskType)
				.containsExactly("renovation", "eviction", "sold");
	}

	@Test
	void metricsSplitActiveAndCompletedWork() {
		OutcomeDto fc = outcomeService.ensure(Map.of("assetHubId", assetHubId, "outcomeType", "fc"), null);
		OutcomeDto note = outcomeService.ensure(Map.of("assetHubId", assetHubId, "outcomeType", "notesale"), null);
		taskService.create(new OutcomeTaskRequest(fc.id(), "nod_noi", LocalDate.of(2024, 1, 1), null));
		taskService.create(new OutcomeTaskRequest(note.id(), "sold", LocalDate.of(2024, 2, 1), null));

		TaskMetricsDto metrics = metricsService.metrics(assetHubId);

		assertThat(metrics.activeCount()).isEqualTo(1);
		assertThat(metrics.completedCount()).isEqualTo(1);
		assertThat(metrics.activeItems()).extracting(TaskMetricsDto.Item::label).containsExactly("Foreclosure: NOD/NOI");
		assertThat(metrics.completedTracks()).extracting(TaskMetricsDto.Item::key).containsExactly("notesale");
		assertThat(metrics.activeTracks()).extracting(TaskMetricsDto.Item::key).containsExactly("fc");
	}

	@Test
	void deleteRemovesTasksAndAuditsRemoval() {
		OutcomeDto shortSale = outcomeService.ensure(Map.of("assetHubId", assetHubId, "outcomeType", "shortsale"), null);
		taskService.create(new OutcomeTaskRequest(shortSale.id(), "listed", null, null));

		outcomeService.delete(shortSale.id(), "manager");

		assertThat(taskRepository.findByAssetHubIdOrderByTaskStartedAscTaskIdAsc(assetHubId)).isEmpty();
		assertThat(outcomeService.list(assetHubId, null)).isEmpty();
		assertThatThrownBy(() -> outcomeService.get(shortSale.id())).isInstanceOf(NotFoundException.class);
		assertThat(auditService.list(assetHubId).get(0)).satisfies(entry -> {
			assertThat(entry.source()).isEqualTo("delete");
			assertThat(entry.oldValue()).isEqualTo("shortsale");
			assertThat(entry.newValue()).isNull();
		});
	}
}
