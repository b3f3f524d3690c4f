package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ValuationRepairItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ValuationRepairItemRepository extends JpaRepository<ValuationRepairItem, Long> {
	List<ValuationRepairItem> findByValuationEtlIdOrderByRepairNumberAsc(Long valuationEtlId);
}
