package my.projectalpha.app.repository;

import my.projectalpha.app.domain.AcqStatus;
import my.projectalpha.app.domain.SellerRawData;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SellerRawDataRepository extends JpaRepository<SellerRawData, Long> {
	Optional<SellerRawData> findByTradeIdAndSellertapeId(Long tradeId, String sellertapeId);

	List<SellerRawData> findByTradeIdOrderBySellertapeIdAsc(Long tradeId);

	List<SellerRawData> findByTradeIdAndAcqStatusOrderBySellertapeIdAsc(Long tradeId, AcqStatus acqStatus);

	List<SellerRawData> findByTradeIdInAndAcqStatus(Collection<Long> tradeIds, AcqStatus acqStatus);

	Optional<SellerRawData> findFirstByAssetHubIdOrderByUpdatedAtDesc(Long assetHubId);

	long countByTradeIdAndAcqStatus(Long tradeId, AcqStatus acqStatus);

	boolean existsByTradeId(Long tradeId);
}
