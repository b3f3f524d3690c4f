package my.projectalpha.app.service;

import my.projectalpha.app.domain.Seller;
import my.projectalpha.app.dto.SellerDto;
import my.projectalpha.app.dto.SellerUpsertRequest;
import my.projectalpha.app.repository.SellerRepository;
import my.projectalpha.app.repository.TradeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class SellerService {
	private static final Logger logger = LoggerFactory.getLogger(SellerService.class);
	private final SellerRepository sellerRepository;
	private final TradeRepository tradeRepository;

	public SellerService(SellerRepository sellerRepository, TradeRepository tradeRepository) {
		this.sellerRepository = sellerRepository;
		this.tradeRepository = tradeRepository;
	}

	public List<SellerDto> list() {
		return sellerRepository.findAllByOrderByNameAsc().stream().map(SellerService::toDto).toList();
	}

	public SellerDto get(Long id) {
		return toDto(require(id));
	}

	@Transactional
	public SellerDto create(SellerUpsertRequest request) {
		String name = request.name().trim();
		if (sellerRepository.findByName(name).isPresent()) {
			throw new IllegalStateException("Seller already exists: " + name);
		}
		Seller seller = new Seller();
		seller.setName(name);
		apply(seller, request);
		seller.setCreatedAt(LocalDateTime.now());
		return toDto(sellerRepository.save(seller));
	}

	@Transactional
	public SellerDto update(Long id, SellerUpsertRequest request) {
		Seller seller = require(id);
		String name = request.name().trim();
		sellerRepository.findByName(name)
				.filter(other -> !other.getSellerId().equals(seller.getSellerId()))
				.ifPresent(other -> {
					throw new IllegalStateException("Seller already exists: " + name);
				});
		seller.setName(name);
		apply(seller, request);
		return toDto(sellerRepository.save(seller));
	}

	@Transactional
	public void delete(Long id) {
		Seller seller = require(id);
		int detached = tradeRepository.detachSeller(seller.getSellerId());
		sellerRepository.delete(seller);
		logger.info("Deleted seller {} ({} trade(s) detached).", seller.getName(), detached);
	}

	/**
	 * Looks a seller up by exact name and creates it when missing.
	 */
	@Transactional
	public Seller getOrCreate(String name) {
		String trimmed = name == null ? "" : name.trim();
		if (trimmed.isEmpty()) {
			throw new IllegalArgumentException("sellerName is required");
		}
		return sellerRepository.findByName(trimmed).orElseGet(() -> {
			Seller seller = new Seller();
			seller.setName(trimmed);
			seller.setCreatedAt(LocalDateTime.now());
			logger.info("Created seller {}.", trimmed);
			return sellerRepository.save(seller);
		});
	}

	Seller require(Long id) {
		return sellerRepository.findById(id).orElseThrow(() -> NotFoundException.of("Seller", id));
	}

	private void apply(Seller seller, SellerUpsertRequest request) {
		seller.setBroker(trimOrNull(request.broker()));
		seller.setEmail(trimOrNull(request.email()));
		seller.setPoc(trimOrNull(request.poc()));
	}

	static SellerDto toDto(Seller seller) {
		return new SellerDto(seller.getSellerId(), seller.getName(), seller.getBroker(), seller.getEmail(),
				seller.getPoc(), seller.getCreatedAt());
	}

	private static String trimOrNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}
