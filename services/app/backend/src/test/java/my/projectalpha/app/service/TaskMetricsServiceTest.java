package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetOutcome;
import my.projectalpha.app.domain.OutcomeTask;
import my.projectalpha.app.domain.OutcomeType;
import my.projectalpha.app.dto.TaskMetricsDto;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskMetricsServiceTest {

	@Test
	void completionTaskMovesTrackToCompleted() {
		AssetOutcome reo = outcome(1L, OutcomeType.REO);
		AssetOutcome mod = outcome(2L, OutcomeType.MODIFICATION);

		TaskMetricsDto metrics = TaskMetricsService.compute(List.of(reo, mod), List.of(
				task(10L, 1L, "listed"),
				task(11L, 1L, "sold"),
				task(12L, 2L, "mod_drafted"),
				task(13L, 99L, "orphan")));

		assertThat(metrics.activeItems()).containsExactly(
				new TaskMetricsDto.Item("reo_10", "REO: Listed", "info"),
				new TaskMetricsDto.Item("modification_12", "Modification: Mod Drafted", "secondary"));
		assertThat(metrics.completedItems()).containsExactly(
				new TaskMetricsDto.Item("reo_11", "REO: Sold", TaskMetricsService.TONE_COMPLETED));
		assertThat(metrics.completedTracks()).extracting(TaskMetricsDto.Item::key).containsExactly("reo");
		assertThat(metrics.activeTracks()).extracting(TaskMetricsDto.Item::key).containsExactly("modification");
		assertThat(metrics.activeCount()).isEqualTo(2);
		assertThat(metrics.completedCount()).isEqualTo(1);
	}

	@Test
	void outcomeWithoutTasksIsAnActiveTrack() {
		TaskMetricsDto metrics = TaskMetricsService.compute(List.of(outcome(5L, OutcomeType.DIL)), List.of());

		assertThat(metrics.activeItems()).isEmpty();
		assertThat(metrics.activeTracks()).containsExactly(new TaskMetricsDto.Item("dil", "Deed-in-Lieu", "primary"));
	}

	private static AssetOutcome outcome(Long id, OutcomeType type) {
		AssetOutcome outcome = new AssetOutcome();
		outcome.setOutcomeId(id);
		outcome.setAssetHubId(7L);
		outcome.setOutcomeType(type);
		return outcome;
	}

	private static OutcomeTask task(Long id, Long outcomeId, String taskType) {
		OutcomeTask task = new OutcomeTask();
		task.setTaskId(id);
		task.setOutcomeId(outcomeId);
		task.setAssetHubId(7L);
		task.setTaskType(taskType);
		return task;
	}
}
