package my.projectalpha.app.service;

import my.projectalpha.app.domain.AcqStatus;
import my.projectalpha.app.domain.Seller;
import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.domain.TradeStatus;
import my.projectalpha.app.dto.OptionDto;
import my.projectalpha.app.dto.TradeDto;
import my.projectalpha.app.dto.TradeStatusDto;
import my.projectalpha.app.dto.TradeUpsertRequest;
import my.projectalpha.app.repository.SellerRawDataRepository;
import my.projectalpha.app.repository.SellerRepository;
import my.projectalpha.app.repository.TradeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class TradeService {
	private static final Logger logger = LoggerFactory.getLogger(TradeService.class);
	private static final DateTimeFormatter TRADE_NAME_DATE = DateTimeFormatter.ofPattern("MM.dd.yy");
	private final TradeRepository tradeRepository;
	private final SellerRepository sellerRepository;
	private final SellerRawDataRepository rawDataRepository;

	public TradeService(TradeRepository tradeRepository,
						SellerRepository sellerRepository,
						SellerRawDataRepository rawDataRepository) {
		this.tradeRepository = tradeRepository;
		this.sellerRepository = sellerRepository;
		this.rawDataRepository = rawDataRepository;
	}

	public List<TradeDto> list(Long sellerId) {
		List<Trade> trades = sellerId == null
				? tradeRepository.findAllByOrderByTradeNameAsc()
				: tradeRepository.findBySellerIdOrderByTradeNameAsc(sellerId);
		Map<Long, String> sellerNames = sellerRepository.findAll().stream()
				.collect(Collectors.toMap(Seller::getSellerId, Seller::getName));
		return trades.stream().map(trade -> toDto(trade, sellerNames.get(trade.getSellerId()))).toList();
	}

	public TradeDto get(Long id) {
		Trade trade = require(id);
		return toDto(trade, sellerName(trade.getSellerId()));
	}

	@Transactional
	public TradeDto create(TradeUpsertRequest request) {
		Seller seller = request.sellerId() == null ? null : sellerRepository.findById(request.sellerId())
				.orElseThrow(() -> NotFoundException.of("Seller", request.sellerId()));
		Trade trade = createTrade(seller, request.tradeName());
		return toDto(trade, seller == null ? null : seller.getName());
	}

	/**
	 * Creates a trade in INDICATIVE state. A blank name is generated from the seller name and today's date.
	 */
	@Transactional
	public Trade createTrade(Seller seller, String tradeName) {
		String name = tradeName == null || tradeName.isBlank()
				? generateTradeName(seller == null ? null : seller.getName(), LocalDate.now())
				: tradeName.trim();
		LocalDateTime now = LocalDateTime.now();
		Trade trade = new Trade();
		trade.setSellerId(seller == null ? null : seller.getSellerId());
		trade.setTradeName(name);
		trade.setStatus(TradeStatus.INDICATIVE);
		trade.setCreatedAt(now);
		trade.setUpdatedAt(now);
		Trade saved = tradeRepository.save(trade);
		logger.info("Created trade {} ({}).", saved.getTradeId(), name);
		return saved;
	}

	@Transactional
	public TradeDto update(Long id, TradeUpsertRequest request) {
		Trade trade = require(id);
		if (request.sellerId() != null && !request.sellerId().equals(trade.getSellerId())) {
			Seller seller = sellerRepository.findById(request.sellerId())
					.orElseThrow(() -> NotFoundException.of("Seller", request.sellerId()));
			trade.setSellerId(seller.getSellerId());
		}
		if (request.tradeName() != null && !request.tradeName().isBlank()) {
			trade.setTradeName(request.tradeName().trim());
		}
		trade.setUpdatedAt(LocalDateTime.now());
		Trade saved = tradeRepository.save(trade);
		return toDto(saved, sellerName(saved.getSellerId()));
	}

	@Transactional
	public void delete(Long id) {
		Trade trade = require(id);
		if (rawDataRepository.existsByTradeId(trade.getTradeId())) {
			throw new IllegalStateException("Trade " + id + " still has tape rows");
		}
		tradeRepository.delete(trade);
	}

	public TradeStatusDto getStatus(Long id) {
		Trade trade = require(id);
		return new TradeStatusDto(trade.getTradeId(), trade.getStatus().name(), statusOptions(), null);
	}

	/**
	 * Sets the trade status. Passing on a trade drops every kept tape row; other statuses leave the
	 * rows alone.
	 */
	@Transactional
	public TradeStatusDto updateStatus(Long id, String value) {
		Trade trade = require(id);
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("status is required");
		}
		TradeStatus status = TradeStatus.parse(value)
				.orElseThrow(() -> new IllegalArgumentException("Invalid status: " + value));
		int modified = 0;
		if (status == TradeStatus.PASS) {
			List<SellerRawData> kept = rawDataRepository.findByTradeIdAndAcqStatusOrderBySellertapeIdAsc(
					trade.getTradeId(), AcqStatus.KEEP);
			LocalDateTime now = LocalDateTime.now();
			for (SellerRawData row : kept) {
				row.setAcqStatus(AcqStatus.DROP);
				row.setUpdatedAt(now);
			}
			rawDataRepository.saveAll(kept);
			modified = kept.size();
		}
		if (trade.getStatus() != status) {
			logger.info("Trade {} status {} -> {} ({} tape row(s) dropped).", trade.getTradeId(), trade.getStatus(),
					status, modified);
		}
		trade.setStatus(status);
		trade.setUpdatedAt(LocalDateTime.now());
		tradeRepository.save(trade);
		return new TradeStatusDto(trade.getTradeId(), status.name(), statusOptions(), modified);
	}

	/**
	 * Re-evaluates the status of a trade after the acquisition status of one of its rows changed.
	 */
	@Transactional
	public Trade refreshStatusFromAssets(Long tradeId) {
		Trade trade = require(tradeId);
		long kept = rawDataRepository.countByTradeIdAndAcqStatus(tradeId, AcqStatus.KEEP);
		if (trade.refreshStatusFromAssets(kept)) {
			logger.info("Trade {} has no kept assets left; status set to {}.", tradeId, trade.getStatus());
			trade.setUpdatedAt(LocalDateTime.now());
			tradeRepository.save(trade);
		}
		return trade;
	}

	public Trade require(Long id) {
		return tradeRepository.findById(id).orElseThrow(() -> NotFoundException.of("Trade", id));
	}

	public static List<OptionDto> statusOptions() {
		return Arrays.stream(TradeStatus.values())
				.map(status -> new OptionDto(status.name(), status.getLabel()))
				.toList();
	}

	/**
	 * {@code <seller name without spaces or punctuation> - MM.dd.yy}.
	 */
	public static String generateTradeName(String sellerName, LocalDate date) {
		String base = sellerName == null ? "" : sellerName.replaceAll("[^A-Za-z0-9]", "");
		if (base.isEmpty()) {
			base = "Trade";
		}
		String suffix = " - " + date.format(TRADE_NAME_DATE);
		if (base.length() + suffix.length() > 100) {
			base = base.substring(0, 100 - suffix.length());
		}
		return base + suffix;
	}

	static TradeDto toDto(Trade trade, String sellerName) {
		return new TradeDto(trade.getTradeId(), trade.getSellerId(), sellerName, trade.getTradeName(),
				trade.getStatus().name(), trade.getStatus().getLabel(), trade.getCreatedAt(), trade.getUpdatedAt());
	}

	private String sellerName(Long sellerId) {
		if (sellerId == null) {
			return null;
		}
		return sellerRepository.findById(sellerId).map(Seller::getName).orElse(null);
	}
}
