package my.projectalpha.app.dto;

import java.util.List;

public record TradeDrilldownDto(TradeReportRowDto trade, List<TapeRowDto> assets) {
}
