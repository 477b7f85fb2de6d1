package my.goalplanner.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.goalplanner.app.model.CatchUpFeasibility;

import java.math.BigDecimal;

public record CatchUpStrategyDto(
		@JsonProperty("years_behind_schedule") double yearsBehindSchedule,
		@JsonProperty("years_remaining") double yearsRemaining,
		@JsonProperty("expected_current_amount") BigDecimal expectedCurrentAmount,
		@JsonProperty("actual_current_amount") BigDecimal actualCurrentAmount,
		@JsonProperty("shortfall") BigDecimal shortfall,
		@JsonProperty("original_required_monthly") BigDecimal originalRequiredMonthly,
		@JsonProperty("catchup_required_monthly") BigDecimal catchUpRequiredMonthly,
		@JsonProperty("additional_monthly_needed") BigDecimal additionalMonthlyNeeded,
		@JsonProperty("catch_up_percentage") double catchUpPercentage,
		@JsonProperty("feasibility") CatchUpFeasibility feasibility,
		@JsonProperty("recommendation") String recommendation
) {
}
