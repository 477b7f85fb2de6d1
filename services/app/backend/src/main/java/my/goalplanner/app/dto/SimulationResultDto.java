package my.goalplanner.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record SimulationResultDto(
		@JsonProperty("success_probability") double successProbability,
		@JsonProperty("median_outcome") BigDecimal medianOutcome,
		@JsonProperty("percentile_10") BigDecimal percentile10,
		@JsonProperty("percentile_25") BigDecimal percentile25,
		@JsonProperty("percentile_75") BigDecimal percentile75,
		@JsonProperty("percentile_90") BigDecimal percentile90,
		@JsonProperty("expected_value") BigDecimal expectedValue,
		@JsonProperty("standard_deviation") BigDecimal standardDeviation,
		@JsonProperty("shortfall_risk") double shortfallRisk,
		@JsonProperty("median_shortfall") BigDecimal medianShortfall,
		@JsonProperty("target_amount") BigDecimal targetAmount,
		@JsonProperty("iterations") int iterations
) {
}
