package my.projectalpha.app.extraction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts of the four extraction passes. Each pass asks for a slice of the report so a single model
 * call stays well below the provider's request timeout.
 */
public final class ValuationPrompts {
	static final List<String> CORE_FIELDS = List.of(
			"source", "valuation_type", "bpo_type",
			"property_address", "city", "state", "zip_code", "parcel_number",
			"loan_number", "deal_name",
			"inspection_date", "effective_date", "report_date",
			"occupancy_status", "property_appears_secure",
			"yearly_taxes", "estimated_monthly_rent", "estimated_monthly_rent_repaired",
			"living_area", "total_rooms", "bedrooms", "bathrooms",
			"year_built", "effective_age", "foundation_type", "basement_square_feet",
			"lot_size_acres", "property_type", "style", "number_of_units", "condition",
			"has_pool", "has_deck", "has_fireplace", "has_fencing",
			"garage", "garage_spaces", "parking_spaces", "parking_type",
			"cooling_type", "heating_type", "water_type", "sewer_type",
			"hoa_fees_monthly", "hoa_fees_annual", "subdivision", "school_district",
			"as_is_value", "as_repaired_value", "quick_sale_value", "quick_sale_value_repaired",
			"land_value", "estimated_marketing_time", "typical_marketing_time_days",
			"recommended_sales_strategy", "recommended_list_price", "recommended_list_price_repaired"
	);

	static final List<String> MARKET_FIELDS = List.of(
			"sold_in_last_12_months", "prior_sale_price", "prior_sale_date",
			"currently_listed", "listing_broker", "listing_agent_email", "listing_agent_firm",
			"initial_list_price", "initial_list_date", "current_list_price",
			"days_on_market", "listing_currently_pending", "pending_contract_date",
			"property_rights_appraised", "sales_comparison_approach", "cost_approach", "income_approach",
			"financeable", "market_trend", "neighborhood_trend", "economic_trend",
			"property_values_trend", "subject_appeal_compared_to_avg", "subject_value_compared_to_avg",
			"housing_supply", "crime_vandalism_risk", "reo_driven_market",
			"num_reo_ss_listings", "num_listings_in_area", "num_boarded_properties",
			"new_construction_in_area", "seasonal_market",
			"neighborhood_price_range_low", "neighborhood_price_range_high",
			"neighborhood_median_price", "neighborhood_average_sales_price",
			"marketability_concerns", "property_comments", "neighborhood_comments", "general_comments",
			"data_source", "data_source_id"
	);

	static final String COMPARABLES_PROMPT = """
			Extract comparable properties from this valuation document.

			Return JSON:
			{
			  "comparables": [
			    {
			      "comp_type": "",
			      "comp_number": 1,
			      "address": "",
			      "city": "",
			      "state": "",
			      "zip_code": "",
			      "proximity_miles": 0,
			      "sale_price": 0,
			      "sale_date": "",
			      "original_list_price": 0,
			      "original_list_date": "",
			      "current_list_price": 0,
			      "days_on_market": 0,
			      "sales_type": "",
			      "seller_concessions": 0,
			      "financing_type": "",
			      "living_area": 0,
			      "bedrooms": 0,
			      "bathrooms": 0,
			      "year_built": 0,
			      "basement_square_feet": 0,
			      "lot_size_acres": 0,
			      "property_type": "",
			      "style": "",
			      "condition": "",
			      "has_pool": false,
			      "has_deck": false,
			      "has_fireplace": false,
			      "garage": "",
			      "parking_spaces": 0,
			      "data_source": "",
			      "data_source_id": "",
			      "total_adjustments": 0,
			      "adjusted_sale_price": 0,
			      "general_comments": ""
			    }
			  ]
			}

			Rules:
			- Extract ALL comparable properties (usually 3-6)
			- comp_type: SALE or LISTING
			- lot_size_acres: convert from sq ft if needed (acres = sq_ft / 43560)
			- bathrooms: total count (e.g., 2.5)
			- null for missing values
			- Return only JSON
			""";

	static final String REPAIRS_PROMPT = """
			Extract repair items from this valuation document.

			Return JSON:
			{
			  "repairs": [
			    {
			      "repair_type": "",
			      "category": "",
			      "description": "",
			      "estimated_cost": 0,
			      "repair_recommended": false
			    }
			  ],
			  "estimated_repair_cost": 0,
			  "general_repair_comments": ""
			}

			Rules:
			- Extract ALL repair items listed
			- repair_type: INTERIOR or EXTERIOR
			- Numbers without $ or commas
			- null for missing values
			- Return only JSON
			""";

	private ValuationPrompts() {
	}

	public static String corePrompt() {
		return fieldPrompt(CORE_FIELDS, "valuation");
	}

	public static String marketPrompt() {
		return fieldPrompt(MARKET_FIELDS, "valuation");
	}

	public static String comparablesPrompt() {
		return COMPARABLES_PROMPT;
	}

	public static String repairsPrompt() {
		return REPAIRS_PROMPT;
	}

	static String fieldPrompt(List<String> fields, String section) {
		String fieldList = fields.stream().map(field -> "  - " + field).collect(Collectors.joining("\n"));
		return """
				Extract property valuation data from this document.

				Return JSON:
				{
				  "%s": {
				    ... fields below ...
				  }
				}

				Rules:
				- Extract fields listed below
				- null for missing values
				- Numbers without $ or commas
				- Dates as YYYY-MM-DD
				- lot_size_acres: convert from sq ft (acres = sq_ft / 43560)
				- bathrooms: total count (e.g., 2.5)
				- Return only JSON

				Fields:
				%s
				""".formatted(section, fieldList);
	}
}
