package my.projectalpha.app.domain;

public enum AssetStatus {
	ACTIVE,
	LIQUIDATED
}
