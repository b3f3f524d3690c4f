package my.projectalpha.app.service;

import my.projectalpha.app.domain.AcqStatus;
import my.projectalpha.app.domain.Seller;
import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.domain.TradeStatus;
import my.projectalpha.app.dto.ChartPointDto;
import my.projectalpha.app.dto.OptionDto;
import my.projectalpha.app.dto.ReportingSummaryDto;
import my.projectalpha.app.dto.SellerOptionDto;
import my.projectalpha.app.dto.StatusReportRowDto;
import my.projectalpha.app.dto.TapeRowDto;
import my.projectalpha.app.dto.TradeDrilldownDto;
import my.projectalpha.app.dto.TradeOptionDto;
import my.projectalpha.app.dto.TradeReportRowDto;
import my.projectalpha.app.reporting.ReportingFilter;
import my.projectalpha.app.reporting.ReportingMetrics;
import my.projectalpha.app.repository.SellerRawDataRepository;
import my.projectalpha.app.repository.SellerRepository;
import my.projectalpha.app.repository.TradeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pipeline reporting over the KEEP rows of the filtered trades.
 */
@Service
public class ReportingService {
	private final TradeRepository tradeRepository;
	private final SellerRepository sellerRepository;
	private final SellerRawDataRepository rawDataRepository;

	public ReportingService(TradeRepository tradeRepository,
							SellerRepository sellerRepository,
							SellerRawDataRepository rawDataRepository) {
		this.tradeRepository = tradeRepository;
		this.sellerRepository = sellerRepository;
		this.rawDataRepository = rawDataRepository;
	}

	@Transactional(readOnly = true)
	public ReportingSummaryDto summary(ReportingFilter filter) {
		List<SellerRawData> rows = rows(trades(filter));
		return new ReportingSummaryDto(ReportingMetrics.totalUpb(rows), rows.size(),
				ReportingMetrics.averageLtv(rows), ReportingMetrics.delinquencyRate(rows));
	}

	@Transactional(readOnly = true)
	public List<TradeReportRowDto> byTrade(ReportingFilter filter) {
		List<Trade> trades = trades(filter);
		Map<Long, List<SellerRawData>> rowsByTrade = rows(trades).stream()
				.collect(Collectors.groupingBy(SellerRawData::getTradeId));
		Map<Long, String> sellerNames = sellerNames(trades);
		List<TradeReportRowDto> result = new ArrayList<>();
		for (Trade trade : trades) {
			List<SellerRawData> tradeRows = rowsByTrade.get(trade.getTradeId());
			if (tradeRows == null || tradeRows.isEmpty()) {
				continue;
			}
			result.add(toRow(trade, sellerNames.get(trade.getSellerId()), tradeRows));
		}
		result.sort(Comparator.comparing(TradeReportRowDto::totalUpb).reversed());
		return result;
	}

	@Transactional(readOnly = true)
	public List<ChartPointDto> byTradeChart(ReportingFilter filter) {
		return byTrade(filter).stream()
				.map(row -> {
					Map<String, Object> meta = new LinkedHashMap<>();
					meta.put("tradeId", row.tradeId());
					meta.put("count", row.assetCount());
					meta.put("ltv", row.avgLtv());
					meta.put("status", row.status());
					return new ChartPointDto(row.tradeName(), row.totalUpb(), meta);
				})
				.toList();
	}

	@Transactional(readOnly = true)
	public List<StatusReportRowDto> byStatus(ReportingFilter filter) {
		List<Trade> trades = trades(filter);
		Map<Long, TradeStatus> statusByTrade = new HashMap<>();
		for (Trade trade : trades) {
			statusByTrade.put(trade.getTradeId(), trade.getStatus());
		}
		Map<TradeStatus, List<SellerRawData>> grouped = new EnumMap<>(TradeStatus.class);
		for (SellerRawData row : rows(trades)) {
			TradeStatus status = statusByTrade.get(row.getTradeId());
			if (status != null) {
				grouped.computeIfAbsent(status, key -> new ArrayList<>()).add(row);
			}
		}
		BigDecimal portfolioUpb = grouped.values().stream()
				.map(ReportingMetrics::totalUpb)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
		List<StatusReportRowDto> result = new ArrayList<>();
		for (Map.Entry<TradeStatus, List<SellerRawData>> entry : grouped.entrySet()) {
			List<SellerRawData> statusRows = entry.getValue();
			long tradeCount = statusRows.stream().map(SellerRawData::getTradeId).distinct().count();
			BigDecimal totalUpb = ReportingMetrics.totalUpb(statusRows);
			result.add(new StatusReportRowDto(entry.getKey().name(), entry.getKey().getLabel(), tradeCount,
					statusRows.size(), totalUpb, ReportingMetrics.averageLtv(statusRows),
					ReportingMetrics.percentOf(totalUpb, portfolioUpb)));
		}
		result.sort(Comparator.comparing(StatusReportRowDto::totalUpb).reversed());
		return result;
	}

	@Transactional(readOnly = true)
	public List<ChartPointDto> byStatusChart(ReportingFilter filter) {
		return byStatus(filter).stream()
				.map(row -> {
					Map<String, Object> meta = new LinkedHashMap<>();
					meta.put("status", row.status());
					meta.put("count", row.assetCount());
					meta.put("percentage", row.percentOfTotalUpb());
					return new ChartPointDto(row.statusLabel(), row.totalUpb(), meta);
				})
				.toList();
	}

	@Transactional(readOnly = true)
	public TradeDrilldownDto tradeDrilldown(Long tradeId) {
		Trade trade = tradeRepository.findById(tradeId)
				.orElseThrow(() -> NotFoundException.of("Trade", tradeId));
		List<SellerRawData> rows = rawDataRepository.findByTradeIdAndAcqStatusOrderBySellertapeIdAsc(tradeId, AcqStatus.KEEP);
		String sellerName = trade.getSellerId() == null ? null
				: sellerRepository.findById(trade.getSellerId()).map(Seller::getName).orElse(null);
		return new TradeDrilldownDto(toRow(trade, sellerName, rows), rows.stream().map(TapeRowDto::from).toList());
	}

	@Transactional(readOnly = true)
	public List<TradeOptionDto> tradeOptions() {
		List<Trade> trades = tradeRepository.findAllByOrderByTradeNameAsc();
		Map<Long, String> sellerNames = sellerNames(trades);
		return trades.stream()
				.map(trade -> new TradeOptionDto(trade.getTradeId(), trade.getTradeName(), sellerNames.get(trade.getSellerId())))
				.toList();
	}

	public List<OptionDto> statusOptions() {
		return TradeService.statusOptions();
	}

	@Transactional(readOnly = true)
	public List<SellerOptionDto> sellerOptions() {
		return sellerRepository.findAllByOrderByNameAsc().stream()
				.map(seller -> new SellerOptionDto(seller.getSellerId(), seller.getName()))
				.toList();
	}

	private List<Trade> trades(ReportingFilter filter) {
		ReportingFilter effective = filter == null ? ReportingFilter.none() : filter;
		return tradeRepository.findAllByOrderByTradeNameAsc().stream()
				.filter(effective::matches)
				.toList();
	}

	private List<SellerRawData> rows(List<Trade> trades) {
		if (trades.isEmpty()) {
			return List.of();
		}
		Set<Long> ids = trades.stream().map(Trade::getTradeId).collect(Collectors.toSet());
		return rawDataRepository.findByTradeIdInAndAcqStatus(ids, AcqStatus.KEEP);
	}

	private Map<Long, String> sellerNames(List<Trade> trades) {
		Set<Long> sellerIds = trades.stream()
				.map(Trade::getSellerId)
				.filter(Objects::nonNull)
				.collect(Collectors.toSet());
		Map<Long, String> names = new HashMap<>();
		for (Seller seller : sellerRepository.findAllById(sellerIds)) {
			names.put(seller.getSellerId(), seller.getName());
		}
		return names;
	}

	private static TradeReportRowDto toRow(Trade trade, String sellerName, List<SellerRawData> rows) {
		return new TradeReportRowDto(trade.getTradeId(), trade.getTradeName(), sellerName,
				trade.getStatus() == null ? null : trade.getStatus().name(), trade.getCreatedAt(), rows.size(),
				ReportingMetrics.totalUpb(rows), ReportingMetrics.averageUpb(rows), ReportingMetrics.averageLtv(rows),
				ReportingMetrics.totalDebt(rows), ReportingMetrics.asisValue(rows));
	}
}
