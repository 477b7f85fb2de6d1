package my.goalplanner.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record MultiGoalOptimizationResultDto(
		@JsonProperty("total_value") BigDecimal totalValue,
		@JsonProperty("expected_return") double expectedReturn,
		@JsonProperty("expected_risk") double expectedRisk,
		@JsonProperty("sharpe_ratio") double sharpeRatio,
		@JsonProperty("goal_allocations") Map<String, BigDecimal> goalAllocations,
		@JsonProperty("goal_portfolios") List<GoalPortfolioDto> goalPortfolios,
		@JsonProperty("account_allocations") Map<String, Map<String, BigDecimal>> accountAllocations,
		@JsonProperty("unplaced") Map<String, BigDecimal> unplaced,
		@JsonProperty("household_allocation") Map<String, Double> householdAllocation,
		@JsonProperty("estimated_tax_drag") double estimatedTaxDrag,
		@JsonProperty("asset_location_efficiency") double assetLocationEfficiency,
		@JsonProperty("diversification_score") double diversificationScore,
		@JsonProperty("rebalancing_needed") boolean rebalancingNeeded,
		@JsonProperty("recommendations") List<String> recommendations
) {
}
