package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetOutcome;
import my.projectalpha.app.domain.OutcomeTask;
import my.projectalpha.app.domain.OutcomeType;
import my.projectalpha.app.dto.MilestoneDto;
import my.projectalpha.app.dto.OutcomeTaskDto;
import my.projectalpha.app.dto.OutcomeTaskRequest;
import my.projectalpha.app.repository.AssetOutcomeRepository;
import my.projectalpha.app.repository.OutcomeTaskRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class OutcomeTaskService {
	private final OutcomeTaskRepository taskRepository;
	private final AssetOutcomeRepository outcomeRepository;
	private final OutcomeService outcomeService;

	public OutcomeTaskService(OutcomeTaskRepository taskRepository,
							  AssetOutcomeRepository outcomeRepository,
							  OutcomeService outcomeService) {
		this.taskRepository = taskRepository;
		this.outcomeRepository = outcomeRepository;
		this.outcomeService = outcomeService;
	}

	public List<OutcomeTaskDto> list(Long assetHubId, Long outcomeId) {
		List<OutcomeTask> tasks;
		if (outcomeId != null) {
			tasks = taskRepository.findByOutcomeIdOrderByTaskStartedAscTaskIdAsc(outcomeId);
		} else if (assetHubId != null) {
			tasks = taskRepository.findByAssetHubIdOrderByTaskStartedAscTaskIdAsc(assetHubId);
		} else {
			throw new IllegalArgumentException("assetHubId or outcomeId is required");
		}
		Map<Long, OutcomeType> types = outcomeTypes(tasks);
		return tasks.stream().map(task -> toDto(task, types.get(task.getOutcomeId()))).toList();
	}

	@Transactional
	public OutcomeTaskDto create(OutcomeTaskRequest request) {
		if (request.outcomeId() == null) {
			throw new IllegalArgumentException("outcomeId is required");
		}
		AssetOutcome outcome = outcomeService.require(request.outcomeId());
		OutcomeType type = outcome.getOutcomeType();
		String taskType = request.taskType() == null ? null : request.taskType().trim();
		if (!type.supportsTask(taskType)) {
			throw new IllegalArgumentException("Task type '" + request.taskType() + "' is not valid for " + type.name()
					+ " outcomes; expected one of " + type.getTaskTypes());
		}
		if (taskRepository.existsByOutcomeIdAndTaskType(outcome.getOutcomeId(), taskType)) {
			throw new IllegalStateException("Task '" + taskType + "' already exists for outcome " + outcome.getOutcomeId());
		}
		OutcomeTask task = new OutcomeTask();
		task.setOutcomeId(outcome.getOutcomeId());
		task.setAssetHubId(outcome.getAssetHubId());
		task.setTaskType(taskType);
		task.setTaskStarted(request.taskStarted() == null ? LocalDate.now() : request.taskStarted());
		task.setNotes(request.notes());
		task.setCreatedAt(LocalDateTime.now());
		return toDto(taskRepository.save(task), type);
	}

	@Transactional
	public OutcomeTaskDto update(Long id, OutcomeTaskRequest request) {
		OutcomeTask task = require(id);
		if (request.taskType() != null && !request.taskType().trim().equals(task.getTaskType())) {
			throw new IllegalArgumentException("taskType cannot be changed");
		}
		if (request.taskStarted() != null) {
			task.setTaskStarted(request.taskStarted());
		}
		if (request.notes() != null) {
			task.setNotes(request.notes());
		}
		OutcomeTask saved = taskRepository.save(task);
		return toDto(saved, outcomeService.require(saved.getOutcomeId()).getOutcomeType());
	}

	@Transactional
	public void delete(Long id) {
		taskRepository.delete(require(id));
	}

	/**
	 * The current task is the existing task furthest along the outcome's task order; the upcoming
	 * task is the one after it.
	 */
	public MilestoneDto milestones(Long outcomeId) {
		AssetOutcome outcome = outcomeService.require(outcomeId);
		OutcomeType type = outcome.getOutcomeType();
		Optional<String> current = taskRepository.findByOutcomeIdOrderByTaskStartedAscTaskIdAsc(outcomeId).stream()
				.map(OutcomeTask::getTaskType)
				.filter(type::supportsTask)
				.max(Comparator.comparingInt(type::taskOrder));
		String upcoming = null;
		if (current.isPresent()) {
			int next = type.taskOrder(current.get()) + 1;
			upcoming = next < type.getTaskTypes().size() ? type.getTaskTypes().get(next) : null;
		}
		return new MilestoneDto(type.name(), current.orElse(null), upcoming);
	}

	private OutcomeTask require(Long id) {
		return taskRepository.findById(id).orElseThrow(() -> NotFoundException.of("Task", id));
	}

	private Map<Long, OutcomeType> outcomeTypes(List<OutcomeTask> tasks) {
		List<Long> outcomeIds = tasks.stream().map(OutcomeTask::getOutcomeId).distinct().toList();
		return outcomeRepository.findAllById(outcomeIds).stream()
				.collect(Collectors.toMap(AssetOutcome::getOutcomeId, AssetOutcome::getOutcomeType));
	}

	static OutcomeTaskDto toDto(OutcomeTask task, OutcomeType type) {
		return new OutcomeTaskDto(task.getTaskId(), task.getOutcomeId(), task.getAssetHubId(),
				type == null ? null : type.name(), task.getTaskType(), OutcomeType.taskLabel(task.getTaskType()),
				task.getTaskStarted(), task.getNotes(), task.getCreatedAt());
	}
}
