package my.goalplanner.app.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Optional fields fall back to the configured planning defaults. {@code seed} makes the run
 * reproducible.
 */
public record SuccessProbabilityRequest(
		@NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal targetAmount,
		@NotNull @PositiveOrZero BigDecimal currentAmount,
		@NotNull @PositiveOrZero BigDecimal monthlyContribution,
		@PositiveOrZero double yearsToGoal,
		@DecimalMin("0.0") @DecimalMax("0.2") Double expectedReturn,
		@DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) Double returnVolatility,
		@Min(1000) @Max(10000) Integer iterations,
		Long seed
) {
}
