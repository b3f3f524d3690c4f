package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ServicerImportFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ServicerImportFileRepository extends JpaRepository<ServicerImportFile, Long> {
	Optional<ServicerImportFile> findFirstByFileHashAndStatus(String fileHash, String status);
}
