package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetOutcome;
import my.projectalpha.app.domain.OutcomeTask;
import my.projectalpha.app.domain.OutcomeType;
import my.projectalpha.app.dto.TaskMetricsDto;
import my.projectalpha.app.repository.AssetOutcomeRepository;
import my.projectalpha.app.repository.OutcomeTaskRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Active and completed work of an asset, shaped for the asset management dashboard chips.
 */
@Service
public class TaskMetricsService {
	static final String TONE_COMPLETED = "success";
	private final AssetOutcomeRepository outcomeRepository;
	private final OutcomeTaskRepository taskRepository;

	public TaskMetricsService(AssetOutcomeRepository outcomeRepository, OutcomeTaskRepository taskRepository) {
		this.outcomeRepository = outcomeRepository;
		this.taskRepository = taskRepository;
	}

	public TaskMetricsDto metrics(Long assetHubId) {
		if (assetHubId == null) {
			throw new IllegalArgumentException("assetHubId is required");
		}
		List<AssetOutcome> outcomes = outcomeRepository.findByAssetHubIdOrderByOutcomeIdAsc(assetHubId);
		List<OutcomeTask> tasks = taskRepository.findByAssetHubIdOrderByTaskStartedAscTaskIdAsc(assetHubId);
		return compute(outcomes, tasks);
	}

	static TaskMetricsDto compute(List<AssetOutcome> outcomes, List<OutcomeTask> tasks) {
		Map<Long, AssetOutcome> byId = outcomes.stream()
				.collect(Collectors.toMap(AssetOutcome::getOutcomeId, Function.identity()));
		List<TaskMetricsDto.Item> activeItems = new ArrayList<>();
		List<TaskMetricsDto.Item> completedItems = new ArrayList<>();
		for (OutcomeTask task : tasks) {
			AssetOutcome outcome = byId.get(task.getOutcomeId());
			if (outcome == null) {
				continue;
			}
			OutcomeType type = outcome.getOutcomeType();
			String key = type.getKey() + "_" + task.getTaskId();
			String label = type.getLabel() + ": " + OutcomeType.taskLabel(task.getTaskType());
			if (type.isCompletion(task.getTaskType())) {
				completedItems.add(new TaskMetricsDto.Item(key, label, TONE_COMPLETED));
			} else {
				activeItems.add(new TaskMetricsDto.Item(key, label, type.getTone()));
			}
		}
		List<TaskMetricsDto.Item> activeTracks = new ArrayList<>();
		List<TaskMetricsDto.Item> completedTracks = new ArrayList<>();
		for (AssetOutcome outcome : outcomes) {
			OutcomeType type = outcome.getOutcomeType();
			boolean completed = tasks.stream()
					.anyMatch(task -> task.getOutcomeId().equals(outcome.getOutcomeId()) && type.isCompletion(task.getTaskType()));
			if (completed) {
				completedTracks.add(new TaskMetricsDto.Item(type.getKey(), type.getLabel(), TONE_COMPLETED));
			} else {
				activeTracks.add(new TaskMetricsDto.Item(type.getKey(), type.getLabel(), type.getTone()));
			}
		}
		return new TaskMetricsDto(activeItems.size(), completedItems.size(), activeItems, completedItems,
				activeTracks, completedTracks);
	}
}
