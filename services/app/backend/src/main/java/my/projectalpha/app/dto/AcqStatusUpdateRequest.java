package my.projectalpha.app.dto;

public record AcqStatusUpdateRequest(String acqStatus) {
}
