package my.goalplanner.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record FundingRequirementsDto(
		@JsonProperty("target_amount") BigDecimal targetAmount,
		@JsonProperty("inflation_adjusted_target") BigDecimal inflationAdjustedTarget,
		@JsonProperty("current_amount") BigDecimal currentAmount,
		@JsonProperty("future_value_current") BigDecimal futureValueCurrent,
		@JsonProperty("remaining_need") BigDecimal remainingNeed,
		@JsonProperty("required_monthly_savings") BigDecimal requiredMonthlySavings,
		@JsonProperty("required_annual_savings") BigDecimal requiredAnnualSavings,
		@JsonProperty("lump_sum_needed_today") BigDecimal lumpSumNeededToday,
		@JsonProperty("present_value_future_contributions") BigDecimal presentValueFutureContributions,
		@JsonProperty("total_funding_required") BigDecimal totalFundingRequired,
		@JsonProperty("funding_percentage") double fundingPercentage,
		@JsonProperty("years_to_goal") double yearsToGoal,
		@JsonProperty("expected_return") double expectedReturn,
		@JsonProperty("inflation_rate") double inflationRate,
		@JsonProperty("real_return") double realReturn
) {
}
