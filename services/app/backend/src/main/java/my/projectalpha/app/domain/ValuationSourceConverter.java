package my.projectalpha.app.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ValuationSourceConverter implements AttributeConverter<ValuationSource, String> {
	@Override
	public String convertToDatabaseColumn(ValuationSource attribute) {
		return attribute == null ? null : attribute.getCode();
	}

	@Override
	public ValuationSource convertToEntityAttribute(String dbData) {
		if (dbData == null) {
			return null;
		}
		return ValuationSource.fromCode(dbData)
				.orElseThrow(() -> new IllegalStateException("Unknown valuation source: " + dbData));
	}
}
