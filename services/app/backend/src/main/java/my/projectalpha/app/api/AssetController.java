package my.projectalpha.app.api;

import my.projectalpha.app.dto.AssetHubDto;
import my.projectalpha.app.service.AssetService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/assets")
public class AssetController {
	private final AssetService assetService;

	public AssetController(AssetService assetService) {
		this.assetService = assetService;
	}

	@GetMapping("/{id}")
	public AssetHubDto get(@PathVariable Long id) {
		return assetService.get(id);
	}
}
