package my.goalplanner.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RequiredContributionDto(
		@JsonProperty("required_monthly_savings") BigDecimal requiredMonthlySavings,
		@JsonProperty("required_annual_savings") BigDecimal requiredAnnualSavings,
		@JsonProperty("target_probability") double targetProbability,
		@JsonProperty("estimated_success_probability") double estimatedSuccessProbability,
		@JsonProperty("median_outcome") BigDecimal medianOutcome,
		@JsonProperty("years_to_goal") double yearsToGoal,
		@JsonProperty("total_contributions") BigDecimal totalContributions,
		@JsonProperty("contribution_percentage") double contributionPercentage,
		@JsonProperty("search_steps") int searchSteps,
		@JsonProperty("converged") boolean converged
) {
}
