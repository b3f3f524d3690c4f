package my.projectalpha.app.api;

import my.projectalpha.app.dto.ServicerImportResult;
import my.projectalpha.app.dto.ServicerLoanDataDto;
import my.projectalpha.app.service.ServicerDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/am")
public class ServicerDataController {
	private static final Logger logger = LoggerFactory.getLogger(ServicerDataController.class);
	private final ServicerDataService servicerDataService;

	public ServicerDataController(ServicerDataService servicerDataService) {
		this.servicerDataService = servicerDataService;
	}

	@GetMapping("/servicer-data")
	public List<ServicerLoanDataDto> list(@RequestParam Long assetHubId) {
		return servicerDataService.list(assetHubId);
	}

	@PostMapping(path = "/imports/servicer-data", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ServicerImportResult importExtract(@RequestParam("file") MultipartFile file,
											  @RequestParam(value = "dryRun", defaultValue = "false") boolean dryRun,
											  @RequestParam(value = "forceReimport", defaultValue = "false") boolean forceReimport,
											  Principal principal) {
		logger.info("Servicer extract {} uploaded by {} (dryRun={}).", file.getOriginalFilename(),
				principal == null ? "system" : principal.getName(), dryRun);
		return servicerDataService.importExtract(file, dryRun, forceReimport);
	}
}
