package my.projectalpha.app.api;

import my.projectalpha.app.dto.OutcomeAuditDto;
import my.projectalpha.app.dto.OutcomeTaskDto;
import my.projectalpha.app.dto.OutcomeTaskRequest;
import my.projectalpha.app.dto.TaskMetricsDto;
import my.projectalpha.app.service.OutcomeAuditService;
import my.projectalpha.app.service.OutcomeTaskService;
import my.projectalpha.app.service.TaskMetricsService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/am")
public class OutcomeTaskController {
	private final OutcomeTaskService taskService;
	private final TaskMetricsService metricsService;
	private final OutcomeAuditService auditService;

	public OutcomeTaskController(OutcomeTaskService taskService,
								 TaskMetricsService metricsService,
								 OutcomeAuditService auditService) {
		this.taskService = taskService;
		this.metricsService = metricsService;
		this.auditService = auditService;
	}

	@GetMapping("/tasks")
	public List<OutcomeTaskDto> list(@RequestParam(required = false) Long assetHubId,
									 @RequestParam(required = false) Long outcomeId) {
		return taskService.list(assetHubId, outcomeId);
	}

	@PostMapping("/tasks")
	@ResponseStatus(HttpStatus.CREATED)
	public OutcomeTaskDto create(@RequestBody OutcomeTaskRequest request) {
		return taskService.create(request);
	}

	@PutMapping("/tasks/{id}")
	public OutcomeTaskDto update(@PathVariable Long id, @RequestBody OutcomeTaskRequest request) {
		return taskService.update(id, request);
	}

	@DeleteMapping("/tasks/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void delete(@PathVariable Long id) {
		taskService.delete(id);
	}

	@GetMapping("/task-metrics")
	public TaskMetricsDto metrics(@RequestParam Long assetHubId) {
		return metricsService.metrics(assetHubId);
	}

	@GetMapping("/audit")
	public List<OutcomeAuditDto> audit(@RequestParam Long assetHubId) {
		return auditService.list(assetHubId);
	}
}
