package my.projectalpha.app.importer;

import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.util.TypedField;

import java.util.Map;

/**
 * One converted data row of a tape. {@code rowNumber} is 1-based and counts data rows only.
 */
public record SellerTapeRow(int rowNumber, String sellertapeId, Map<TypedField<SellerRawData>, Object> values) {

	public void applyTo(SellerRawData target) {
		for (Map.Entry<TypedField<SellerRawData>, Object> entry : values.entrySet()) {
			entry.getKey().write(target, entry.getValue());
		}
	}
}
