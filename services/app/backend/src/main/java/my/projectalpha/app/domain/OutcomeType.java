package my.projectalpha.app.domain;

import java.util.List;
import java.util.Locale;

/**
 * Asset management resolution tracks. Each track owns an ordered task vocabulary, the task that
 * closes the track and the outcome fields that apply to it.
 */
public enum OutcomeType {
	REO("reo", "info",
			List.of("eviction", "trashout", "renovation", "pre_marketing", "listed", "under_contract", "sold"),
			"sold",
			List.of("list_price", "list_date", "under_contract_flag", "under_contract_date", "contract_price",
					"estimated_close_date", "actual_close_date", "seller_credit_amount", "purchase_type",
					"gross_purchase_price")),
	FC("fc", "danger",
			List.of("nod_noi", "fc_filing", "mediation", "judgement", "redemption", "sale_scheduled", "sold"),
			"sold",
			List.of("nod_noi_sent_date", "nod_noi_expire_date", "fc_sale_scheduled_date", "fc_sale_actual_date",
					"fc_bid_price", "fc_sale_price")),
	DIL("dil", "primary",
			List.of("pursuing_dil", "owner_contacted", "dil_failed", "dil_drafted", "dil_executed"),
			"dil_executed",
			List.of("dil_completion_date", "dil_cost", "cfk_cost")),
	SHORT_SALE("shortsale", "warning",
			List.of("list_price_accepted", "listed", "under_contract", "sold"),
			"sold",
			List.of("acceptable_min_offer", "short_sale_date", "gross_proceeds")),
	MODIFICATION("modification", "secondary",
			List.of("mod_drafted", "mod_executed", "mod_rpl", "mod_failed", "note_sale"),
			"mod_executed",
			List.of("modification_date", "modification_cost", "modification_payment_type")),
	NOTE_SALE("notesale", "secondary",
			List.of("potential_note_sale", "out_to_market", "pending_sale", "sold"),
			"sold",
			List.of("sold_date", "proceeds"));

	private final String key;
	private final String tone;
	private final List<String> taskTypes;
	private final String completionTaskType;
	private final List<String> fieldNames;

	OutcomeType(String key, String tone, List<String> taskTypes, String completionTaskType, List<String> fieldNames) {
		this.key = key;
		this.tone = tone;
		this.taskTypes = taskTypes;
		this.completionTaskType = completionTaskType;
		this.fieldNames = fieldNames;
	}

	public String getKey() {
		return key;
	}

	public String getTone() {
		return tone;
	}

	public List<String> getTaskTypes() {
		return taskTypes;
	}

	public String getCompletionTaskType() {
		return completionTaskType;
	}

	public List<String> getFieldNames() {
		return fieldNames;
	}

	public String getLabel() {
		switch (this) {
			case FC:
				return "Foreclosure";
			case DIL:
				return "Deed-in-Lieu";
			case SHORT_SALE:
				return "Short Sale";
			case MODIFICATION:
				return "Modification";
			case NOTE_SALE:
				return "Note Sale";
			default:
				return "REO";
		}
	}

	/**
	 * "pre_marketing" becomes "Pre Marketing", "nod_noi" becomes "NOD/NOI".
	 */
	public static String taskLabel(String taskType) {
		if ("nod_noi".equals(taskType)) {
			return "NOD/NOI";
		}
		StringBuilder label = new StringBuilder();
		for (String part : taskType.split("_")) {
			if (part.isEmpty()) {
				continue;
			}
			if (label.length() > 0) {
				label.append(' ');
			}
			if (part.equals("dil") || part.equals("fc") || part.equals("rpl")) {
				label.append(part.toUpperCase(Locale.ROOT));
			} else {
				label.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
			}
		}
		return label.toString();
	}

	public boolean supportsTask(String taskType) {
		return taskType != null && taskTypes.contains(taskType);
	}

	public boolean isCompletion(String taskType) {
		return completionTaskType.equals(taskType);
	}

	public int taskOrder(String taskType) {
		return taskTypes.indexOf(taskType);
	}

	public static OutcomeType parse(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("outcomeType is required");
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		for (OutcomeType type : values()) {
			if (type.name().equals(normalized) || type.key.equalsIgnoreCase(value.trim())) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown outcomeType: " + value);
	}
}
