package my.projectalpha.app.dto;

import my.projectalpha.app.domain.ServicerLoanData;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.stream.Stream;

public record ServicerLoanDataDto(Long id,
								  Long assetHubId,
								  String servicerId,
								  String investorId,
								  Integer reportingYear,
								  Integer reportingMonth,
								  LocalDate asOfDate,
								  String address,
								  String city,
								  String state,
								  String zipCode,
								  String occupancy,
								  String propertyType,
								  String borrowerLastName,
								  Integer currentFico,
								  BigDecimal currentBalance,
								  BigDecimal deferredBalance,
								  BigDecimal interestRate,
								  LocalDate nextDueDate,
								  LocalDate lastPaidDate,
								  BigDecimal escrowBalance,
								  BigDecimal escrowAdvanceBalance,
								  BigDecimal thirdPartyRecovBalance,
								  BigDecimal suspenseBalance,
								  BigDecimal servicerLateFees,
								  BigDecimal otherCharges,
								  BigDecimal interestArrears,
								  BigDecimal totalDebt,
								  BigDecimal computedTotalDebt,
								  Integer lienPos,
								  LocalDate maturityDate,
								  BigDecimal avmValue,
								  BigDecimal bpoAsisValue,
								  BigDecimal bpoArvValue,
								  Boolean fcFlag,
								  String fcStatus,
								  Boolean bkFlag,
								  String primStat,
								  LocalDateTime updatedAt) {

	public static ServicerLoanDataDto from(ServicerLoanData row) {
		return new ServicerLoanDataDto(
				row.getServicerLoanDataId(),
				row.getAssetHubId(),
				row.getServicerId(),
				row.getInvestorId(),
				row.getReportingYear(),
				row.getReportingMonth(),
				row.getAsOfDate(),
				row.getAddress(),
				row.getCity(),
				row.getState(),
				row.getZipCode(),
				row.getOccupancy(),
				row.getPropertyType(),
				row.getBorrowerLastName(),
				row.getCurrentFico(),
				row.getCurrentBalance(),
				row.getDeferredBalance(),
				row.getInterestRate(),
				row.getNextDueDate(),
				row.getLastPaidDate(),
				row.getEscrowBalance(),
				row.getEscrowAdvanceBalance(),
				row.getThirdPartyRecovBalance(),
				row.getSuspenseBalance(),
				row.getServicerLateFees(),
				row.getOtherCharges(),
				row.getInterestArrears(),
				row.getTotalDebt(),
				computedTotalDebt(row),
				row.getLienPos(),
				row.getMaturityDate(),
				row.getAvmValue(),
				row.getBpoAsisValue(),
				row.getBpoArvValue(),
				row.getFcFlag(),
				row.getFcStatus(),
				row.getBkFlag(),
				row.getPrimStat(),
				row.getUpdatedAt());
	}

	/**
	 * Balance plus every receivable the servicer reports; null when none of them is present.
	 */
	static BigDecimal computedTotalDebt(ServicerLoanData row) {
		return Stream.of(row.getCurrentBalance(), row.getDeferredBalance(), row.getEscrowAdvanceBalance(),
						row.getThirdPartyRecovBalance(), row.getSuspenseBalance(), row.getServicerLateFees(),
						row.getOtherCharges(), row.getInterestArrears())
				.filter(value -> value != null)
				.reduce(BigDecimal::add)
				.orElse(null);
	}
}
