package my.projectalpha.app.api;

import my.projectalpha.app.dto.TapeImportResult;
import my.projectalpha.app.service.SellerTapeImportService;
import my.projectalpha.app.service.TapeImportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.security.Principal;

@RestController
@RequestMapping("/api/acq/imports")
public class SellerTapeImportController {
	private static final Logger logger = LoggerFactory.getLogger(SellerTapeImportController.class);
	private final SellerTapeImportService importService;

	public SellerTapeImportController(SellerTapeImportService importService) {
		this.importService = importService;
	}

	@PostMapping(path = "/seller-tape", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public TapeImportResult importSellerTape(@RequestParam("file") MultipartFile file,
											 @RequestParam(value = "sellerName", required = false) String sellerName,
											 @RequestParam(value = "tradeId", required = false) Long tradeId,
											 @RequestParam(value = "tradeName", required = false) String tradeName,
											 @RequestParam(value = "autoCreate", defaultValue = "true") boolean autoCreate,
											 @RequestParam(value = "updateExisting", defaultValue = "false") boolean updateExisting,
											 @RequestParam(value = "dryRun", defaultValue = "false") boolean dryRun,
											 @RequestParam(value = "forceReimport", defaultValue = "false") boolean forceReimport,
											 Principal principal) {
		String requestedBy = principal == null ? "system" : principal.getName();
		logger.info("Seller tape {} uploaded by {} (seller={}, tradeId={}, dryRun={}).", file.getOriginalFilename(),
				requestedBy, sellerName, tradeId, dryRun);
		TapeImportOptions options = new TapeImportOptions(sellerName, tradeId, tradeName, autoCreate, updateExisting,
				dryRun, forceReimport);
		return importService.importTape(file, options);
	}
}
