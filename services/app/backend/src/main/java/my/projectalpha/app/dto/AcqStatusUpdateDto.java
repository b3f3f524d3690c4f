package my.projectalpha.app.dto;

public record AcqStatusUpdateDto(TapeRowDto asset, String tradeStatus, boolean tradeStatusChanged) {
}
