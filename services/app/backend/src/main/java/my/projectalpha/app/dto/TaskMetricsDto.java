package my.projectalpha.app.dto;

import java.util.List;

public record TaskMetricsDto(int activeCount,
							 int completedCount,
							 List<Item> activeItems,
							 List<Item> completedItems,
							 List<Item> activeTracks,
							 List<Item> completedTracks) {

	public record Item(String key, String label, String tone) {
	}
}
