package my.projectalpha.app.domain;

public enum ExtractionStatus {
	PENDING,
	IN_PROGRESS,
	PARTIAL,
	COMPLETE,
	FAILED
}
