package my.goalplanner.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.goalplanner.app.model.TimelineStatus;

import java.math.BigDecimal;

/**
 * {@code requiredYears} is infinite when the goal cannot be reached without contributions.
 */
public record ContributionTimelineDto(
		@JsonProperty("status") TimelineStatus status,
		@JsonProperty("optimal_monthly_contribution") BigDecimal optimalMonthlyContribution,
		@JsonProperty("original_years") double originalYears,
		@JsonProperty("required_years") double requiredYears,
		@JsonProperty("additional_years") double additionalYears,
		@JsonProperty("projected_value") BigDecimal projectedValue,
		@JsonProperty("surplus") BigDecimal surplus,
		@JsonProperty("shortfall") BigDecimal shortfall,
		@JsonProperty("recommendation") String recommendation
) {
}
