package my.projectalpha.app.api;

import my.projectalpha.app.dto.AcqStatusUpdateDto;
import my.projectalpha.app.dto.AcqStatusUpdateRequest;
import my.projectalpha.app.dto.TapeRowDto;
import my.projectalpha.app.service.AcqAssetService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/acq")
public class AcqAssetController {
	private final AcqAssetService acqAssetService;

	public AcqAssetController(AcqAssetService acqAssetService) {
		this.acqAssetService = acqAssetService;
	}

	@GetMapping("/trades/{tradeId}/assets")
	public List<TapeRowDto> listAssets(@PathVariable Long tradeId,
									   @RequestParam(required = false) String acqStatus) {
		return acqAssetService.listForTrade(tradeId, acqStatus);
	}

	@PutMapping("/assets/{id}/acq-status")
	public AcqStatusUpdateDto setAcqStatus(@PathVariable Long id, @RequestBody AcqStatusUpdateRequest request) {
		return acqAssetService.setAcqStatus(id, request == null ? null : request.acqStatus());
	}
}
