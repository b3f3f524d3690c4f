package my.projectalpha.app.api;

import jakarta.validation.Valid;
import my.projectalpha.app.dto.SellerDto;
import my.projectalpha.app.dto.SellerUpsertRequest;
import my.projectalpha.app.service.SellerService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sellers")
public class SellerController {
	private final SellerService sellerService;

	public SellerController(SellerService sellerService) {
		this.sellerService = sellerService;
	}

	@GetMapping
	public List<SellerDto> list() {
		return sellerService.list();
	}

	@GetMapping("/{id}")
	public SellerDto get(@PathVariable Long id) {
		return sellerService.get(id);
	}

	@PostMapping
	@ResponseStatus(HttpStatus.CREATED)
	public SellerDto create(@Valid @RequestBody SellerUpsertRequest request) {
		return sellerService.create(request);
	}

	@PutMapping("/{id}")
	public SellerDto update(@PathVariable Long id, @Valid @RequestBody SellerUpsertRequest request) {
		return sellerService.update(id, request);
	}

	@DeleteMapping("/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void delete(@PathVariable Long id) {
		sellerService.delete(id);
	}
}
