package my.projectalpha.app.api;

import my.projectalpha.app.dto.ExtractedValuationDto;
import my.projectalpha.app.dto.PipelineSummary;
import my.projectalpha.app.dto.ValuationDocumentDetailDto;
import my.projectalpha.app.dto.ValuationDocumentDto;
import my.projectalpha.app.service.ValuationDocumentService;
import my.projectalpha.app.service.ValuationExtractionPipeline;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/etl")
public class EtlController {
	private final ValuationExtractionPipeline pipeline;
	private final ValuationDocumentService documentService;

	public EtlController(ValuationExtractionPipeline pipeline, ValuationDocumentService documentService) {
		this.pipeline = pipeline;
		this.documentService = documentService;
	}

	@PostMapping(path = "/valuation-documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@ResponseStatus(HttpStatus.CREATED)
	public PipelineSummary upload(@RequestParam("file") MultipartFile file,
								  @RequestParam("assetHubId") Long assetHubId,
								  @RequestParam(value = "source", required = false) String source,
								  Principal principal) {
		if (file == null || file.isEmpty()) {
			throw new IllegalArgumentException("File is empty");
		}
		byte[] content;
		try {
			content = file.getBytes();
		} catch (IOException ex) {
			throw new IllegalArgumentException("Unable to read uploaded file.", ex);
		}
		String createdBy = principal == null ? "system" : principal.getName();
		return pipeline.processDocument(content, file.getOriginalFilename(), assetHubId, source, createdBy);
	}

	@GetMapping("/valuation-documents")
	public List<ValuationDocumentDto> list(@RequestParam(required = false) Long assetHubId) {
		return documentService.list(assetHubId);
	}

	@GetMapping("/valuation-documents/{id}")
	public ValuationDocumentDetailDto get(@PathVariable Long id) {
		return documentService.get(id);
	}

	@GetMapping("/valuations/{id}")
	public ExtractedValuationDto valuation(@PathVariable Long id) {
		return documentService.getValuation(id);
	}
}
