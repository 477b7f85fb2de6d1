package my.goalplanner.app.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CatchUpStrategyRequest(
		@NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal targetAmount,
		@NotNull @PositiveOrZero BigDecimal currentAmount,
		@PositiveOrZero double yearsRemaining,
		@PositiveOrZero double yearsBehindSchedule,
		@DecimalMin("0.0") @DecimalMax("0.2") Double expectedReturn
) {
}
