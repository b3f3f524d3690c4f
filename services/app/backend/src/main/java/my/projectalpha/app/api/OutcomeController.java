package my.projectalpha.app.api;

import my.projectalpha.app.dto.MilestoneDto;
import my.projectalpha.app.dto.OutcomeDto;
import my.projectalpha.app.service.OutcomeService;
import my.projectalpha.app.service.OutcomeTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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

import java.security.Principal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/am/outcomes")
public class OutcomeController {
	private final OutcomeService outcomeService;
	private final OutcomeTaskService taskService;

	public OutcomeController(OutcomeService outcomeService, OutcomeTaskService taskService) {
		this.outcomeService = outcomeService;
		this.taskService = taskService;
	}

	@GetMapping
	public List<OutcomeDto> list(@RequestParam(required = false) Long assetHubId,
								 @RequestParam(required = false) String type) {
		return outcomeService.list(assetHubId, type);
	}

	@GetMapping("/{id}")
	public OutcomeDto get(@PathVariable Long id) {
		return outcomeService.get(id);
	}

	@PostMapping
	public ResponseEntity<OutcomeDto> ensure(@RequestBody Map<String, Object> body, Principal principal) {
		return ResponseEntity.ok(outcomeService.ensure(body, editedBy(principal)));
	}

	@PutMapping("/{id}")
	public OutcomeDto update(@PathVariable Long id, @RequestBody Map<String, Object> body, Principal principal) {
		return outcomeService.update(id, body, editedBy(principal));
	}

	@DeleteMapping("/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void delete(@PathVariable Long id, Principal principal) {
		outcomeService.delete(id, editedBy(principal));
	}

	@GetMapping("/{id}/milestones")
	public MilestoneDto milestones(@PathVariable Long id) {
		return taskService.milestones(id);
	}

	private static String editedBy(Principal principal) {
		return principal == null ? "system" : principal.getName();
	}
}
