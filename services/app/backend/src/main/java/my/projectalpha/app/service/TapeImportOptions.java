package my.projectalpha.app.service;

public record TapeImportOptions(String sellerName,
								Long tradeId,
								String tradeName,
								boolean autoCreate,
								boolean updateExisting,
								boolean dryRun,
								boolean forceReimport) {
}
