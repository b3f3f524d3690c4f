package my.projectalpha.app.api;

import jakarta.validation.Valid;
import my.projectalpha.app.dto.TradeDto;
import my.projectalpha.app.dto.TradeStatusDto;
import my.projectalpha.app.dto.TradeStatusUpdateRequest;
import my.projectalpha.app.dto.TradeUpsertRequest;
import my.projectalpha.app.service.TradeService;
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
@RequestMapping("/api/trades")
public class TradeController {
	private final TradeService tradeService;

	public TradeController(TradeService tradeService) {
		this.tradeService = tradeService;
	}

	@GetMapping
	public List<TradeDto> list(@RequestParam(required = false) Long sellerId) {
		return tradeService.list(sellerId);
	}

	@GetMapping("/{id}")
	public TradeDto get(@PathVariable Long id) {
		return tradeService.get(id);
	}

	@PostMapping
	@ResponseStatus(HttpStatus.CREATED)
	public TradeDto create(@Valid @RequestBody TradeUpsertRequest request) {
		return tradeService.create(request);
	}

	@PutMapping("/{id}")
	public TradeDto update(@PathVariable Long id, @Valid @RequestBody TradeUpsertRequest request) {
		return tradeService.update(id, request);
	}

	@DeleteMapping("/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void delete(@PathVariable Long id) {
		tradeService.delete(id);
	}

	@GetMapping("/{id}/status")
	public TradeStatusDto status(@PathVariable Long id) {
		return tradeService.getStatus(id);
	}

	@PutMapping("/{id}/status")
	public TradeStatusDto updateStatus(@PathVariable Long id, @RequestBody TradeStatusUpdateRequest request) {
		return tradeService.updateStatus(id, request == null ? null : request.status());
	}
}
