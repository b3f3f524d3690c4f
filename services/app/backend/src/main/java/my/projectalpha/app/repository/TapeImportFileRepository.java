package my.projectalpha.app.repository;

import my.projectalpha.app.domain.TapeImportFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TapeImportFileRepository extends JpaRepository<TapeImportFile, Long> {
	Optional<TapeImportFile> findFirstBySellerIdAndFileHashAndStatus(Long sellerId, String fileHash, String status);
}
