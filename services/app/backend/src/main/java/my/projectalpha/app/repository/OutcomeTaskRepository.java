package my.projectalpha.app.repository;

import my.projectalpha.app.domain.OutcomeTask;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OutcomeTaskRepository extends JpaRepository<OutcomeTask, Long> {
	List<OutcomeTask> findByAssetHubIdOrderByTaskStartedAscTaskIdAsc(Long assetHubId);

	List<OutcomeTask> findByOutcomeIdOrderByTaskStartedAscTaskIdAsc(Long outcomeId);

	boolean existsByOutcomeIdAndTaskType(Long outcomeId, String taskType);

	void deleteByOutcomeId(Long outcomeId);
}
