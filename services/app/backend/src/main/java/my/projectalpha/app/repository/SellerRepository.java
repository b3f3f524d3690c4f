package my.projectalpha.app.repository;

import my.projectalpha.app.domain.Seller;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SellerRepository extends JpaRepository<Seller, Long> {
	Optional<Seller> findByName(String name);

	List<Seller> findAllByOrderByNameAsc();
}
