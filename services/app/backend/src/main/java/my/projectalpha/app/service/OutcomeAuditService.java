package my.projectalpha.app.service;

import my.projectalpha.app.domain.OutcomeAuditEntry;
import my.projectalpha.app.domain.OutcomeType;
import my.projectalpha.app.dto.OutcomeAuditDto;
import my.projectalpha.app.repository.OutcomeAuditEntryRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class OutcomeAuditService {
	static final String SOURCE_CREATE = "create";
	static final String SOURCE_UPDATE = "update";
	static final String SOURCE_DELETE = "delete";
	private static final int MAX_VALUE_LENGTH = 1000;
	private final OutcomeAuditEntryRepository repository;

	public OutcomeAuditService(OutcomeAuditEntryRepository repository) {
		this.repository = repository;
	}

	public void recordEdit(Long assetHubId, OutcomeType outcomeType, String field, Object oldValue, Object newValue,
						   String editedBy, String source) {
		OutcomeAuditEntry entry = new OutcomeAuditEntry();
		entry.setAssetHubId(assetHubId);
		entry.setOutcomeType(outcomeType.name());
		entry.setField(field);
		entry.setOldValue(render(oldValue));
		entry.setNewValue(render(newValue));
		entry.setEditedAt(LocalDateTime.now());
		entry.setEditedBy(editedBy == null || editedBy.isBlank() ? "system" : editedBy);
		entry.setSource(source);
		repository.save(entry);
	}

	public List<OutcomeAuditDto> list(Long assetHubId) {
		if (assetHubId == null) {
			throw new IllegalArgumentException("assetHubId is required");
		}
		return repository.findByAssetHubIdOrderByEditedAtDescIdDesc(assetHubId).stream()
				.map(entry -> new OutcomeAuditDto(entry.getId(), entry.getAssetHubId(), entry.getOutcomeType(),
						entry.getField(), entry.getOldValue(), entry.getNewValue(), entry.getEditedBy(),
						entry.getEditedAt(), entry.getSource()))
				.toList();
	}

	private static String render(Object value) {
		if (value == null) {
			return null;
		}
		String text = value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
		return text.length() <= MAX_VALUE_LENGTH ? text : text.substring(0, MAX_VALUE_LENGTH);
	}
}
