package my.projectalpha.app.dto;

import my.projectalpha.app.domain.SellerRawData;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record TapeRowDto(Long id,
						 Long sellerId,
						 Long tradeId,
						 Long assetHubId,
						 String sellertapeId,
						 String acqStatus,
						 String assetClass,
						 LocalDate asOfDate,
						 String streetAddress,
						 String city,
						 String state,
						 String zip,
						 BigDecimal currentBalance,
						 BigDecimal totalDebt,
						 BigDecimal interestRate,
						 Integer monthsDlq,
						 BigDecimal sellerAsisValue,
						 BigDecimal sellerArvValue,
						 Boolean fcFlag,
						 Boolean bkFlag,
						 Boolean modFlag,
						 LocalDateTime updatedAt) {

	public static TapeRowDto from(SellerRawData row) {
		return new TapeRowDto(
				row.getSellerRawDataId(),
				row.getSellerId(),
				row.getTradeId(),
				row.getAssetHubId(),
				row.getSellertapeId(),
				row.getAcqStatus() == null ? null : row.getAcqStatus().name(),
				row.getAssetClass() == null ? null : row.getAssetClass().name(),
				row.getAsOfDate(),
				row.getStreetAddress(),
				row.getCity(),
				row.getState(),
				row.getZip(),
				row.getCurrentBalance(),
				row.getTotalDebt(),
				row.getInterestRate(),
				row.getMonthsDlq(),
				row.getSellerAsisValue(),
				row.getSellerArvValue(),
				row.getFcFlag(),
				row.getBkFlag(),
				row.getModFlag(),
				row.getUpdatedAt()
		);
	}
}
