package my.projectalpha.app.dto;

import java.util.List;

/**
 * Current status of a trade with the selectable options. {@code assetsModified} is only set in
 * answers to a status change.
 */
public record TradeStatusDto(Long tradeId,
							 String status,
							 List<OptionDto> options,
							 Integer assetsModified) {
}
