package my.projectalpha.app.api;

import jakarta.validation.Valid;
import my.projectalpha.app.dto.OptionDto;
import my.projectalpha.app.dto.ValuationDto;
import my.projectalpha.app.dto.ValuationUpsertRequest;
import my.projectalpha.app.service.ValuationService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/valuations")
public class ValuationController {
	private final ValuationService valuationService;

	public ValuationController(ValuationService valuationService) {
		this.valuationService = valuationService;
	}

	@GetMapping
	public List<ValuationDto> list(@RequestParam(required = false) Long assetHubId) {
		return valuationService.list(assetHubId);
	}

	@GetMapping("/sources")
	public List<OptionDto> sources() {
		return valuationService.sources();
	}

	@PostMapping
	@ResponseStatus(HttpStatus.CREATED)
	public ValuationDto create(@Valid @RequestBody ValuationUpsertRequest request) {
		return valuationService.create(request);
	}

	@PutMapping("/{id}")
	public ValuationDto update(@PathVariable Long id, @Valid @RequestBody ValuationUpsertRequest request) {
		return valuationService.update(id, request);
	}

	@DeleteMapping("/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void delete(@PathVariable Long id) {
		valuationService.delete(id);
	}
}
