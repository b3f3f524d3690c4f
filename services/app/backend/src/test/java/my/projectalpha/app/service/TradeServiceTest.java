package my.projectalpha.app.service;

import my.projectalpha.app.domain.AcqStatus;
import my.projectalpha.app.domain.Seller;
import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.domain.TradeStatus;
import my.projectalpha.app.dto.OptionDto;
import my.projectalpha.app.dto.TradeStatusDto;
import my.projectalpha.app.repository.SellerRawDataRepository;
import my.projectalpha.app.repository.SellerRepository;
import my.projectalpha.app.repository.TradeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradeServiceTest {
	@Mock
	private TradeRepository tradeRepository;

	@Mock
	private SellerRepository sellerRepository;

	@Mock
	private SellerRawDataRepository rawDataRepository;

	@InjectMocks
	private TradeService tradeService;

	@Test
	void generatedNameStripsPunctuationAndAppendsDate() {
		assertThat(TradeService.generateTradeName("Acme Capital, LLC", LocalDate.of(2024, 3, 7)))
				.isEqualTo("AcmeCapitalLLC - 03.07.24");
		assertThat(TradeService.generateTradeName(null, LocalDate.of(2025, 12, 31)))
				.isEqualTo("Trade - 12.31.25");
	}

	@Test
	void generatedNameFitsColumn() {
		String name = TradeService.generateTradeName("x".repeat(150), LocalDate.of(2024, 1, 1));
		assertThat(name).hasSize(100).endsWith(" - 01.01.24");
	}

	@Test
	void createTradeStartsIndicative() {
		Seller seller = new Seller();
		seller.setSellerId(4L);
		seller.setName("Acme");
		when(tradeRepository.save(any(Trade.class))).thenAnswer(invocation -> invocation.getArgument(0));

		Trade trade = tradeService.createTrade(seller, "  Pool A ");

		assertThat(trade.getTradeName()).isEqualTo("Pool A");
		assertThat(trade.getSellerId()).isEqualTo(4L);
		assertThat(trade.getStatus()).isEqualTo(TradeStatus.INDICATIVE);
		assertThat(trade.getCreatedAt()).isNotNull();
	}

	@Test
	void passingTradeDropsKeptRows() {
		Trade trade = trade(TradeStatus.DD);
		SellerRawData first = row(AcqStatus.KEEP);
		SellerRawData second = row(AcqStatus.KEEP);
		when(tradeRepository.findById(1L)).thenReturn(Optional.of(trade));
		when(rawDataRepository.findByTradeIdAndAcqStatusOrderBySellertapeIdAsc(1L, AcqStatus.KEEP))
				.thenReturn(List.of(first, second));

		TradeStatusDto result = tradeService.updateStatus(1L, "pass");

		assertThat(result.status()).isEqualTo("PASS");
		assertThat(result.assetsModified()).isEqualTo(2);
		assertThat(first.getAcqStatus()).isEqualTo(AcqStatus.DROP);
		assertThat(second.getAcqStatus()).isEqualTo(AcqStatus.DROP);
		assertThat(trade.getStatus()).isEqualTo(TradeStatus.PASS);
		verify(tradeRepository).save(trade);
	}

	@Test
	void otherStatusesLeaveRowsAlone() {
		Trade trade = trade(TradeStatus.INDICATIVE);
		when(tradeRepository.findById(1L)).thenReturn(Optional.of(trade));

		TradeStatusDto result = tradeService.updateStatus(1L, "AWARDED");

		assertThat(result.assetsModified()).isZero();
		assertThat(result.options()).extracting(OptionDto::value)
				.containsExactly("PASS", "INDICATIVE", "DD", "AWARDED", "CLOSED", "BOARD");
		verify(rawDataRepository, never()).saveAll(anyList());
	}

	@Test
	void invalidStatusIsRejected() {
		when(tradeRepository.findById(1L)).thenReturn(Optional.of(trade(TradeStatus.DD)));

		assertThatThrownBy(() -> tradeService.updateStatus(1L, "won"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Invalid status: won");
		assertThatThrownBy(() -> tradeService.updateStatus(1L, " "))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("status is required");
	}

	@Test
	void deleteRefusesTradeWithRows() {
		when(tradeRepository.findById(1L)).thenReturn(Optional.of(trade(TradeStatus.DD)));
		when(rawDataRepository.existsByTradeId(1L)).thenReturn(true);

		assertThatThrownBy(() -> tradeService.delete(1L)).isInstanceOf(IllegalStateException.class);
		verify(tradeRepository, never()).delete(any(Trade.class));
	}

	@Test
	void missingTradeIsNotFound() {
		when(tradeRepository.findById(9L)).thenReturn(Optional.empty());

		assertThatThrownBy(() -> tradeService.get(9L))
				.isInstanceOf(NotFoundException.class)
				.hasMessage("Trade not found: 9");
	}

	@Test
	void refreshPassesTradeWithoutKeptRows() {
		Trade trade = trade(TradeStatus.INDICATIVE);
		when(tradeRepository.findById(1L)).thenReturn(Optional.of(trade));
		when(rawDataRepository.countByTradeIdAndAcqStatus(1L, AcqStatus.KEEP)).thenReturn(0L);

		tradeService.refreshStatusFromAssets(1L);

		assertThat(trade.getStatus()).isEqualTo(TradeStatus.PASS);
		verify(tradeRepository).save(trade);
	}

	private static Trade trade(TradeStatus status) {
		Trade trade = new Trade();
		trade.setTradeId(1L);
		trade.setTradeName("Pool");
		trade.setStatus(status);
		return trade;
	}

	private static SellerRawData row(AcqStatus status) {
		SellerRawData row = new SellerRawData();
		row.setTradeId(1L);
		row.setAcqStatus(status);
		return row;
	}
}
