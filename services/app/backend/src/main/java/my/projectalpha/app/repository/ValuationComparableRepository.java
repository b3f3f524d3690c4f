package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ValuationComparable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ValuationComparableRepository extends JpaRepository<ValuationComparable, Long> {
	List<ValuationComparable> findByValuationEtlIdOrderByCompNumberAsc(Long valuationEtlId);
}
