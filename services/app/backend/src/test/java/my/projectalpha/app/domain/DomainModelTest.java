package my.projectalpha.app.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainModelTest {
	@Test
	void assetClassAcceptsSpelledOutForms() {
		assertThat(AssetClass.parse("npl")).isEqualTo(AssetClass.NPL);
		assertThat(AssetClass.parse("Non-Performing Loan")).isEqualTo(AssetClass.NPL);
		assertThat(AssetClass.parse("Real Estate Owned")).isEqualTo(AssetClass.REO);
		assertThat(AssetClass.parse("Re-Performing")).isEqualTo(AssetClass.RPL);
		assertThat(AssetClass.parse(" ")).isNull();
		assertThatThrownBy(() -> AssetClass.parse("commercial"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("commercial");
	}

	@Test
	void tradeStatusParseIsCaseInsensitive() {
		assertThat(TradeStatus.parse("dd")).contains(TradeStatus.DD);
		assertThat(TradeStatus.parse("Board")).contains(TradeStatus.BOARD);
		assertThat(TradeStatus.parse("won")).isEmpty();
		assertThat(TradeStatus.BOARD.getLabel()).isEqualTo("Boarded");
	}

	@Test
	void acqStatusRejectsUnknownValues() {
		assertThat(AcqStatus.parse(" drop ")).isEqualTo(AcqStatus.DROP);
		assertThatThrownBy(() -> AcqStatus.parse("hold")).hasMessage("Invalid acqStatus: hold");
		assertThatThrownBy(() -> AcqStatus.parse(null)).hasMessage("acqStatus is required");
	}

	@Test
	void tradePassesWhenNoKeptAssetsRemain() {
		Trade trade = new Trade();
		trade.setStatus(TradeStatus.DD);
		assertThat(trade.refreshStatusFromAssets(2)).isFalse();
		assertThat(trade.getStatus()).isEqualTo(TradeStatus.DD);
		assertThat(trade.refreshStatusFromAssets(0)).isTrue();
		assertThat(trade.getStatus()).isEqualTo(TradeStatus.PASS);
	}

	@Test
	void awardedAndBoardedTradesKeepTheirStatus() {
		Trade awarded = new Trade();
		awarded.setStatus(TradeStatus.AWARDED);
		Trade boarded = new Trade();
		boarded.setStatus(TradeStatus.BOARD);
		assertThat(awarded.refreshStatusFromAssets(0)).isFalse();
		assertThat(boarded.refreshStatusFromAssets(0)).isFalse();
		assertThat(awarded.getStatus()).isEqualTo(TradeStatus.AWARDED);
	}

	@Test
	void outcomeTypeTaskVocabulary() {
		assertThat(OutcomeType.parse("shortsale")).isEqualTo(OutcomeType.SHORT_SALE);
		assertThat(OutcomeType.parse("note-sale")).isEqualTo(OutcomeType.NOTE_SALE);
		assertThat(OutcomeType.REO.supportsTask("trashout")).isTrue();
		assertThat(OutcomeType.REO.supportsTask("fc_filing")).isFalse();
		assertThat(OutcomeType.DIL.isCompletion("dil_executed")).isTrue();
		assertThat(OutcomeType.FC.taskOrder("judgement")).isEqualTo(3);
		assertThatThrownBy(() -> OutcomeType.parse("auction")).hasMessage("Unknown outcomeType: auction");
	}

	@Test
	void taskLabelsAreHumanReadable() {
		assertThat(OutcomeType.taskLabel("pre_marketing")).isEqualTo("Pre Marketing");
		assertThat(OutcomeType.taskLabel("nod_noi")).isEqualTo("NOD/NOI");
		assertThat(OutcomeType.taskLabel("dil_drafted")).isEqualTo("DIL Drafted");
		assertThat(OutcomeType.taskLabel("mod_rpl")).isEqualTo("Mod RPL");
	}

	@Test
	void valuationSourceMatchesCodesAndLabels() {
		assertThat(ValuationSource.match("Broker Valuation")).contains(ValuationSource.BROKER);
		assertThat(ValuationSource.match("bpoi")).contains(ValuationSource.BPO_INTERIOR);
		assertThat(ValuationSource.match("B.P.O.E")).contains(ValuationSource.BPO_EXTERIOR);
		assertThat(ValuationSource.match("internalInitialUW")).contains(ValuationSource.INTERNAL_INITIAL_UW);
		assertThat(ValuationSource.fromCode("appraisal")).contains(ValuationSource.APPRAISAL);
		assertThat(ValuationSource.fromCode("Appraisal")).isEmpty();
	}
}
