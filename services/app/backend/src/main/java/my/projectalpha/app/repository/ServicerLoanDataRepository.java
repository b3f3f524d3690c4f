package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ServicerLoanData;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ServicerLoanDataRepository extends JpaRepository<ServicerLoanData, Long> {
	Optional<ServicerLoanData> findByServicerIdAndReportingYearAndReportingMonth(String servicerId, Integer reportingYear,
																				 Integer reportingMonth);

	List<ServicerLoanData> findByAssetHubIdOrderByReportingYearDescReportingMonthDescServicerLoanDataIdDesc(Long assetHubId);
}
