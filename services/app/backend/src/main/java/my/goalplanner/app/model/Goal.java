package my.goalplanner.app.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Goal(
		@NotBlank String id,
		String name,
		@NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal targetAmount,
		@NotNull @PositiveOrZero BigDecimal currentAmount,
		@PositiveOrZero double yearsToGoal,
		@NotNull GoalPriority priority,
		@DecimalMin("0.0") @DecimalMax("100.0") BigDecimal fundingPercentage,
		LocalDate targetDate
) {
	private static final BigDecimal FULL_FUNDING = new BigDecimal("100");

	public BigDecimal effectiveFundingPercentage() {
		return fundingPercentage == null ? FULL_FUNDING : fundingPercentage;
	}

	public BigDecimal shortfall() {
		BigDecimal gap = targetAmount.subtract(currentAmount == null ? BigDecimal.ZERO : currentAmount);
		return gap.signum() < 0 ? BigDecimal.ZERO : gap;
	}
}
