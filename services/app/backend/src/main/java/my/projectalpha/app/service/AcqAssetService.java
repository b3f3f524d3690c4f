package my.projectalpha.app.service;

import my.projectalpha.app.domain.AcqStatus;
import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.domain.TradeStatus;
import my.projectalpha.app.dto.AcqStatusUpdateDto;
import my.projectalpha.app.dto.TapeRowDto;
import my.projectalpha.app.repository.SellerRawDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class AcqAssetService {
	private static final Logger logger = LoggerFactory.getLogger(AcqAssetService.class);
	private final SellerRawDataRepository rawDataRepository;
	private final TradeService tradeService;

	public AcqAssetService(SellerRawDataRepository rawDataRepository, TradeService tradeService) {
		this.rawDataRepository = rawDataRepository;
		this.tradeService = tradeService;
	}

	public List<TapeRowDto> listForTrade(Long tradeId, String acqStatus) {
		tradeService.require(tradeId);
		List<SellerRawData> rows = acqStatus == null || acqStatus.isBlank()
				? rawDataRepository.findByTradeIdOrderBySellertapeIdAsc(tradeId)
				: rawDataRepository.findByTradeIdAndAcqStatusOrderBySellertapeIdAsc(tradeId, AcqStatus.parse(acqStatus));
		return rows.stream().map(TapeRowDto::from).toList();
	}

	/**
	 * Keeps or drops a tape row, then lets the trade fall back to PASS once nothing is kept.
	 */
	@Transactional
	public AcqStatusUpdateDto setAcqStatus(Long rowId, String value) {
		AcqStatus acqStatus = AcqStatus.parse(value);
		SellerRawData row = rawDataRepository.findById(rowId).orElseThrow(() -> NotFoundException.of("Asset", rowId));
		if (row.getAcqStatus() != acqStatus) {
			logger.info("Tape row {} of trade {}: {} -> {}.", rowId, row.getTradeId(), row.getAcqStatus(), acqStatus);
			row.setAcqStatus(acqStatus);
			row.setUpdatedAt(LocalDateTime.now());
			rawDataRepository.saveAndFlush(row);
		}
		TradeStatus before = tradeService.require(row.getTradeId()).getStatus();
		Trade trade = tradeService.refreshStatusFromAssets(row.getTradeId());
		return new AcqStatusUpdateDto(TapeRowDto.from(row), trade.getStatus().name(), before != trade.getStatus());
	}
}
