package my.projectalpha.app.repository;

import my.projectalpha.app.domain.Trade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TradeRepository extends JpaRepository<Trade, Long> {
	List<Trade> findAllByOrderByTradeNameAsc();

	List<Trade> findBySellerIdOrderByTradeNameAsc(Long sellerId);

	Optional<Trade> findFirstBySellerIdOrderByCreatedAtDescTradeIdDesc(Long sellerId);

	@Modifying
	@Query("update Trade t set t.sellerId = null where t.sellerId = :sellerId")
	int detachSeller(@Param("sellerId") Long sellerId);
}
