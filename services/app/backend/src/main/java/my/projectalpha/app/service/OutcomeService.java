package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetOutcome;
import my.projectalpha.app.domain.OutcomeType;
import my.projectalpha.app.dto.OutcomeDto;
import my.projectalpha.app.repository.AssetOutcomeRepository;
import my.projectalpha.app.repository.OutcomeTaskRepository;
import my.projectalpha.app.util.TypedField;
import my.projectalpha.app.util.ValueCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolution tracks of an asset. Outcome bodies are flat maps of snake_case field names; only the
 * fields of the outcome's type are accepted and every changed value is audited.
 */
@Service
public class OutcomeService {
	private static final Logger logger = LoggerFactory.getLogger(OutcomeService.class);
	private static final Set<String> RESERVED_KEYS = Set.of("assetHubId", "asset_hub_id", "outcomeType", "outcome_type", "id");
	private final AssetOutcomeRepository outcomeRepository;
	private final OutcomeTaskRepository taskRepository;
	private final AssetService assetService;
	private final OutcomeAuditService auditService;

	public OutcomeService(AssetOutcomeRepository outcomeRepository,
						  OutcomeTaskRepository taskRepository,
						  AssetService assetService,
						  OutcomeAuditService auditService) {
		this.outcomeRepository = outcomeRepository;
		this.taskRepository = taskRepository;
		this.assetService = assetService;
		this.auditService = auditService;
	}

	public List<OutcomeDto> list(Long assetHubId, String type) {
		if (assetHubId == null) {
			return List.of();
		}
		OutcomeType filter = type == null || type.isBlank() ? null : OutcomeType.parse(type);
		return outcomeRepository.findByAssetHubIdOrderByOutcomeIdAsc(assetHubId).stream()
				.filter(outcome -> filter == null || outcome.getOutcomeType() == filter)
				.map(OutcomeService::toDto)
				.toList();
	}

	public OutcomeDto get(Long id) {
		return toDto(require(id));
	}

	/**
	 * Returns the existing outcome of that type for the asset, or creates it with the given fields.
	 */
	@Transactional
	public OutcomeDto ensure(Map<String, Object> body, String editedBy) {
		Long assetHubId = readLong(body, "assetHubId", "asset_hub_id");
		Object typeValue = body.containsKey("outcomeType") ? body.get("outcomeType") : body.get("outcome_type");
		OutcomeType type = OutcomeType.parse(typeValue == null ? null : typeValue.toString());
		assetService.require(assetHubId);
		Optional<AssetOutcome> existing = outcomeRepository.findByAssetHubIdAndOutcomeType(assetHubId, type);
		if (existing.isPresent()) {
			return toDto(existing.get());
		}
		LocalDateTime now = LocalDateTime.now();
		AssetOutcome outcome = new AssetOutcome();
		outcome.setAssetHubId(assetHubId);
		outcome.setOutcomeType(type);
		outcome.setCreatedAt(now);
		outcome.setUpdatedAt(now);
		Map<String, Object> values = resolveValues(type, withoutReserved(body));
		values.forEach((name, value) -> field(name).write(outcome, value));
		AssetOutcome saved = outcomeRepository.save(outcome);
		auditService.recordEdit(assetHubId, type, "outcome", null, type.getKey(), editedBy, OutcomeAuditService.SOURCE_CREATE);
		values.forEach((name, value) -> auditService.recordEdit(assetHubId, type, name, null, value, editedBy,
				OutcomeAuditService.SOURCE_CREATE));
		logger.info("Created {} outcome {} for asset {}.", type, saved.getOutcomeId(), assetHubId);
		return toDto(saved);
	}

	@Transactional
	public OutcomeDto update(Long id, Map<String, Object> body, String editedBy) {
		AssetOutcome outcome = require(id);
		OutcomeType type = outcome.getOutcomeType();
		Map<String, Object> values = resolveValues(type, withoutReserved(body));
		boolean changed = false;
		for (Map.Entry<String, Object> entry : values.entrySet()) {
			TypedField<AssetOutcome> field = field(entry.getKey());
			Object oldValue = field.read(outcome);
			if (sameValue(oldValue, entry.getValue())) {
				continue;
			}
			field.write(outcome, entry.getValue());
			auditService.recordEdit(outcome.getAssetHubId(), type, entry.getKey(), oldValue, entry.getValue(), editedBy,
					OutcomeAuditService.SOURCE_UPDATE);
			changed = true;
		}
		if (changed) {
			outcome.setUpdatedAt(LocalDateTime.now());
			outcome = outcomeRepository.save(outcome);
		}
		return toDto(outcome);
	}

	/**
	 * Removes the outcome together with its tasks.
	 */
	@Transactional
	public void delete(Long id, String editedBy) {
		AssetOutcome outcome = require(id);
		taskRepository.deleteByOutcomeId(outcome.getOutcomeId());
		outcomeRepository.delete(outcome);
		auditService.recordEdit(outcome.getAssetHubId(), outcome.getOutcomeType(), "outcome",
				outcome.getOutcomeType().getKey(), null, editedBy, OutcomeAuditService.SOURCE_DELETE);
		logger.info("Deleted {} outcome {} of asset {}.", outcome.getOutcomeType(), id, outcome.getAssetHubId());
	}

	AssetOutcome require(Long id) {
		return outcomeRepository.findById(id).orElseThrow(() -> NotFoundException.of("Outcome", id));
	}

	/**
	 * Validates and converts the requested values. Unknown or foreign fields and unreadable values
	 * are rejected; an explicit blank or null clears the field.
	 */
	static Map<String, Object> resolveValues(OutcomeType type, Map<String, Object> body) {
		Map<String, Object> values = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : body.entrySet()) {
			String name = entry.getKey();
			if (!type.getFieldNames().contains(name)) {
				throw new IllegalArgumentException("Field '" + name + "' does not apply to " + type.name() + " outcomes");
			}
			TypedField<AssetOutcome> field = field(name);
			Object raw = entry.getValue();
			Object value = ValueCoercion.coerce(raw, field.type());
			if (value == null && !ValueCoercion.isEmpty(raw)) {
				throw new IllegalArgumentException("Invalid value for " + name + ": " + raw);
			}
			if (value instanceof String text) {
				String lowered = text.trim().toLowerCase(Locale.ROOT);
				Set<String> choices = OutcomeFields.CHOICES.get(name);
				if (choices != null && !choices.contains(lowered)) {
					throw new IllegalArgumentException("Invalid value for " + name + ": " + raw + " (allowed " + choices + ")");
				}
				value = choices != null ? lowered : text.trim();
				if (field.exceedsMaxLength(value)) {
					throw new IllegalArgumentException(name + " exceeds " + field.maxLength() + " characters");
				}
			}
			values.put(name, value);
		}
		return values;
	}

	static OutcomeDto toDto(AssetOutcome outcome) {
		Map<String, Object> fields = new LinkedHashMap<>();
		for (String name : outcome.getOutcomeType().getFieldNames()) {
			fields.put(name, field(name).read(outcome));
		}
		return new OutcomeDto(outcome.getOutcomeId(), outcome.getAssetHubId(), outcome.getOutcomeType().name(),
				outcome.getOutcomeType().getLabel(), fields, outcome.getCreatedAt(), outcome.getUpdatedAt());
	}

	private static TypedField<AssetOutcome> field(String name) {
		return OutcomeFields.lookup(name).orElseThrow(() -> new IllegalArgumentException("Unknown field: " + name));
	}

	private static Map<String, Object> withoutReserved(Map<String, Object> body) {
		Map<String, Object> copy = new LinkedHashMap<>(body == null ? Map.of() : body);
		RESERVED_KEYS.forEach(copy::remove);
		return copy;
	}

	private static boolean sameValue(Object oldValue, Object newValue) {
		if (oldValue instanceof BigDecimal left && newValue instanceof BigDecimal right) {
			return left.compareTo(right) == 0;
		}
		return Objects.equals(oldValue, newValue);
	}

	private static Long readLong(Map<String, Object> body, String... keys) {
		for (String key : keys) {
			Object value = body.get(key);
			if (value instanceof Number number) {
				return number.longValue();
			}
			if (value instanceof String text && !text.isBlank()) {
				try {
					return Long.parseLong(text.trim());
				} catch (NumberFormatException ex) {
					throw new IllegalArgumentException("Invalid " + key + ": " + text, ex);
				}
			}
		}
		throw new IllegalArgumentException(keys[0] + " is required");
	}
}
