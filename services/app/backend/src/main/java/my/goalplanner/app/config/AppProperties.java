package my.goalplanner.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import my.goalplanner.app.model.GoalPriority;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Simulation simulation,
		@Valid @NotNull Solver solver,
		@Valid @NotNull GlidePath glidePath,
		@Valid @NotNull Planning planning,
		@Valid @NotNull Cma cma
) {
	public record Simulation(
			@Min(1) int defaultIterations,
			@Min(1) int batchSize,
			@Min(1) int parallelism
	) {
	}

	public record Solver(
			@Min(1) int searchIterations,
			@Min(1) int verificationIterations,
			@DecimalMin("0.01") double toleranceAmount,
			@Min(1) int maxSteps,
			@DecimalMin("1.0") double bracketMultiplier,
			@Min(0) int maxBracketExpansions
	) {
	}

	public record GlidePath(
			@DecimalMin("0.0") @DecimalMax("0.2") double riskFreeRate,
			@Valid @NotNull EquitySplit equitySplit,
			@Valid @NotNull FixedIncomeSplit fixedIncomeSplit,
			Map<GoalPriority, Double> priorityAdjustments
	) {
		public record EquitySplit(
				@DecimalMin("0.0") double domestic,
				@DecimalMin("0.0") double international,
				@DecimalMin("0.0") double emerging
		) {
		}

		public record FixedIncomeSplit(
				@DecimalMin("0.0") double bonds,
				@DecimalMin("0.0") double inflationProtected,
				@DecimalMin("0.0") double cash
		) {
		}

		public double priorityAdjustment(GoalPriority priority) {
			if (priority == null) {
				return 0.0;
			}
			if (priorityAdjustments == null || !priorityAdjustments.containsKey(priority)) {
				return priority.getDefaultRiskAdjustment();
			}
			Double value = priorityAdjustments.get(priority);
			return value == null ? priority.getDefaultRiskAdjustment() : value;
		}
	}

	public record Planning(
			@DecimalMin("0.0") @DecimalMax("0.2") double defaultExpectedReturn,
			@DecimalMin("0.001") @DecimalMax("0.999") double defaultVolatility,
			@DecimalMin("0.0") @DecimalMax("0.2") double defaultInflation,
			@DecimalMin("0.0") @DecimalMax("1.0") double driftThreshold
	) {
	}

	public record Cma(
			@NotBlank String resource
	) {
	}
}
