package my.goalplanner.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

public record GoalPortfolioDto(
		@JsonProperty("goal_id") String goalId,
		@JsonProperty("goal_name") String goalName,
		@JsonProperty("allocated_amount") BigDecimal allocatedAmount,
		@JsonProperty("risk_tolerance") double riskTolerance,
		@JsonProperty("weights") Map<String, Double> weights,
		@JsonProperty("expected_return") double expectedReturn,
		@JsonProperty("expected_risk") double expectedRisk,
		@JsonProperty("sharpe_ratio") double sharpeRatio
) {
}
