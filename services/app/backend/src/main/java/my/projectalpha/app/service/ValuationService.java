package my.projectalpha.app.service;

import my.projectalpha.app.domain.Valuation;
import my.projectalpha.app.domain.ValuationSource;
import my.projectalpha.app.dto.OptionDto;
import my.projectalpha.app.dto.ValuationDto;
import my.projectalpha.app.dto.ValuationUpsertRequest;
import my.projectalpha.app.repository.ValuationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

@Service
public class ValuationService {
	private final ValuationRepository valuationRepository;
	private final AssetService assetService;

	public ValuationService(ValuationRepository valuationRepository, AssetService assetService) {
		this.valuationRepository = valuationRepository;
		this.assetService = assetService;
	}

	public List<ValuationDto> list(Long assetHubId) {
		if (assetHubId == null) {
			throw new IllegalArgumentException("assetHubId is required");
		}
		return valuationRepository.findByAssetHubIdOrderByValueDateDescCreatedAtDesc(assetHubId).stream()
				.map(ValuationService::toDto)
				.toList();
	}

	@Transactional
	public ValuationDto create(ValuationUpsertRequest request) {
		assetService.require(request.assetHubId());
		ValuationSource source = parseSource(request.source());
		ensureUnique(null, request.assetHubId(), source, request);
		LocalDateTime now = LocalDateTime.now();
		Valuation valuation = new Valuation();
		valuation.setAssetHubId(request.assetHubId());
		valuation.setCreatedAt(now);
		apply(valuation, source, request, now);
		return toDto(valuationRepository.save(valuation));
	}

	@Transactional
	public ValuationDto update(Long id, ValuationUpsertRequest request) {
		Valuation valuation = valuationRepository.findById(id).orElseThrow(() -> NotFoundException.of("Valuation", id));
		if (!valuation.getAssetHubId().equals(request.assetHubId())) {
			throw new IllegalArgumentException("assetHubId cannot be changed");
		}
		ValuationSource source = parseSource(request.source());
		ensureUnique(id, request.assetHubId(), source, request);
		apply(valuation, source, request, LocalDateTime.now());
		return toDto(valuationRepository.save(valuation));
	}

	@Transactional
	public void delete(Long id) {
		if (!valuationRepository.existsById(id)) {
			throw NotFoundException.of("Valuation", id);
		}
		valuationRepository.deleteById(id);
	}

	public List<OptionDto> sources() {
		return Arrays.stream(ValuationSource.values())
				.map(source -> new OptionDto(source.getCode(), source.getLabel()))
				.toList();
	}

	private void ensureUnique(Long selfId, Long assetHubId, ValuationSource source, ValuationUpsertRequest request) {
		valuationRepository.findByAssetHubIdAndSourceAndValueDate(assetHubId, source, request.valueDate())
				.filter(existing -> !existing.getValuationId().equals(selfId))
				.ifPresent(existing -> {
					throw new IllegalStateException("A " + source.getCode() + " valuation dated " + request.valueDate()
							+ " already exists for asset " + assetHubId);
				});
	}

	private void apply(Valuation valuation, ValuationSource source, ValuationUpsertRequest request, LocalDateTime now) {
		valuation.setSource(source);
		valuation.setAsisValue(request.asisValue());
		valuation.setArvValue(request.arvValue());
		valuation.setValueDate(request.valueDate());
		valuation.setRehabEstTotal(request.rehabEstTotal());
		valuation.setRecommendRehab(request.recommendRehab());
		valuation.setNotes(request.notes());
		valuation.setLinks(request.links());
		valuation.setUpdatedAt(now);
	}

	private static ValuationSource parseSource(String value) {
		return ValuationSource.fromCode(value == null ? null : value.trim())
				.or(() -> ValuationSource.match(value))
				.orElseThrow(() -> new IllegalArgumentException("Unknown valuation source: " + value));
	}

	static ValuationDto toDto(Valuation valuation) {
		return new ValuationDto(valuation.getValuationId(), valuation.getAssetHubId(), valuation.getSource().getCode(),
				valuation.getSource().getLabel(), valuation.getAsisValue(), valuation.getArvValue(),
				valuation.getValueDate(), valuation.getRehabEstTotal(), valuation.getRecommendRehab(),
				valuation.getNotes(), valuation.getLinks(), valuation.getCreatedAt(), valuation.getUpdatedAt());
	}
}
