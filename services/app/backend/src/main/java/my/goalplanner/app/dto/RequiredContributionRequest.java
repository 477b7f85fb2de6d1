package my.goalplanner.app.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record RequiredContributionRequest(
		@NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal targetAmount,
		@NotNull @PositiveOrZero BigDecimal currentAmount,
		@PositiveOrZero double yearsToGoal,
		@DecimalMin("0.5") @DecimalMax("0.99") Double targetProbability,
		@DecimalMin("0.0") @DecimalMax("0.2") Double expectedReturn,
		@DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) Double returnVolatility,
		Long seed
) {
}
