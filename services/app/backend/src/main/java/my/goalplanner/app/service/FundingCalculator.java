package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.model.CatchUpFeasibility;
import my.goalplanner.app.model.TimelineStatus;
import org.apache.commons.math3.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Closed-form time-value-of-money helpers. Every method is a pure function of its arguments
 * apart from the configured default inflation used for catch-up and timeline planning.
 */
@Service
public class FundingCalculator {
	private static final double TIMELINE_TOLERANCE_YEARS = 0.1;

	private final double defaultInflation;

	public FundingCalculator(AppProperties properties) {
		this.defaultInflation = properties.planning().defaultInflation();
	}

	public Requirements requirements(double target, double current, double years,
									 double expectedReturn, double inflation) {
		double realReturn = (1 + expectedReturn) / (1 + inflation) - 1;
		double inflationAdjustedTarget = target * FastMath.pow(1 + inflation, years);
		double futureValueCurrent = current * FastMath.pow(1 + expectedReturn, years);
		double remainingNeed = Math.max(0.0, inflationAdjustedTarget - futureValueCurrent);

		double months = years * 12;
		double requiredMonthly = annuityPayment(remainingNeed, expectedReturn / 12, months);
		double requiredAnnual = annuityPayment(remainingNeed, expectedReturn, years);

		double lumpSum = years > 0
				? remainingNeed / FastMath.pow(1 + expectedReturn, years)
				: remainingNeed;
		double presentValueContributions = presentValueOfContributions(requiredMonthly, years, expectedReturn);
		double totalFundingRequired = current + presentValueContributions;
		double fundingPercentage = totalFundingRequired > 0 ? current / totalFundingRequired * 100 : 0.0;

		return new Requirements(target, inflationAdjustedTarget, current, futureValueCurrent, remainingNeed,
				requiredMonthly, requiredAnnual, lumpSum, presentValueContributions, totalFundingRequired,
				fundingPercentage, years, expectedReturn, inflation, realReturn);
	}

	public CatchUp catchUp(double target, double current, double yearsRemaining, double yearsBehind,
						   double expectedReturn) {
		double originalTimeline = yearsRemaining + yearsBehind;
		double expectedProgress = originalTimeline > 0 ? yearsBehind / originalTimeline : 0.0;
		double expectedCurrent = target * expectedProgress;
		double shortfall = expectedCurrent - current;

		double originalRequired = requirements(target, 0.0, originalTimeline, expectedReturn, defaultInflation)
				.requiredMonthly();
		double catchUpRequired = requirements(target, current, yearsRemaining, expectedReturn, defaultInflation)
				.requiredMonthly();
		double additional = catchUpRequired - originalRequired;
		double catchUpPercentage = originalRequired > 0 ? additional / originalRequired * 100 : 0.0;

		return new CatchUp(yearsBehind, yearsRemaining, expectedCurrent, current, shortfall, originalRequired,
				catchUpRequired, additional, catchUpPercentage, feasibility(additional, originalRequired),
				catchUpRecommendation(additional, originalRequired));
	}

	public Timeline timeline(double target, double current, double years, double maxMonthlyContribution,
							 double expectedReturn) {
		double monthlyRate = expectedReturn / 12;
		double projectedValue = projectValue(current, maxMonthlyContribution, monthlyRate, years * 12);

		if (projectedValue >= target) {
			double requiredMonthly = requirements(target, current, years, expectedReturn, defaultInflation)
					.requiredMonthly();
			return new Timeline(TimelineStatus.ACHIEVABLE,
					Math.min(requiredMonthly, maxMonthlyContribution),
					years, years, 0.0, projectedValue, projectedValue - target, 0.0,
					"Goal achievable with lower contributions");
		}

		double requiredYears;
		if (maxMonthlyContribution == 0) {
			if (current > 0 && expectedReturn > 0) {
				requiredYears = FastMath.log(target / current) / FastMath.log(1 + expectedReturn);
			} else {
				requiredYears = Double.POSITIVE_INFINITY;
			}
		} else {
			double low = years;
			double high = years > 0 ? years * 3 : 1.0;
			while (high - low > TIMELINE_TOLERANCE_YEARS) {
				double mid = (low + high) / 2;
				if (projectValue(current, maxMonthlyContribution, monthlyRate, mid * 12) < target) {
					low = mid;
				} else {
					high = mid;
				}
			}
			requiredYears = (low + high) / 2;
		}
		double additionalYears = requiredYears - years;
		String recommendation = Double.isFinite(additionalYears)
				? String.format(Locale.ROOT,
						"Extend timeline by %.1f years or increase monthly contribution", additionalYears)
				: "Goal cannot be reached without contributions; increase monthly contribution";
		return new Timeline(TimelineStatus.TIMELINE_EXTENSION_NEEDED, maxMonthlyContribution, years,
				requiredYears, additionalYears, projectedValue, 0.0, target - projectedValue, recommendation);
	}

	/**
	 * Level payment that accumulates {@code futureValue} over {@code periods} at {@code periodicRate}.
	 */
	public static double annuityPayment(double futureValue, double periodicRate, double periods) {
		if (periods <= 0) {
			return futureValue;
		}
		if (periodicRate == 0) {
			return futureValue / periods;
		}
		return futureValue * periodicRate / (FastMath.pow(1 + periodicRate, periods) - 1);
	}

	public static double projectValue(double current, double monthlyContribution, double monthlyRate, double months) {
		double growth = FastMath.pow(1 + monthlyRate, months);
		double contributions = monthlyRate > 0
				? monthlyContribution * (growth - 1) / monthlyRate
				: monthlyContribution * months;
		return current * growth + contributions;
	}

	private double presentValueOfContributions(double monthlyContribution, double years, double annualReturn) {
		if (years <= 0) {
			return 0.0;
		}
		double months = years * 12;
		double monthlyRate = annualReturn / 12;
		if (monthlyRate == 0) {
			return monthlyContribution * months;
		}
		return monthlyContribution * (1 - FastMath.pow(1 + monthlyRate, -months)) / monthlyRate;
	}

	private CatchUpFeasibility feasibility(double additional, double original) {
		if (additional < original * 0.5) {
			return CatchUpFeasibility.HIGH;
		}
		if (additional < original) {
			return CatchUpFeasibility.MEDIUM;
		}
		return CatchUpFeasibility.CHALLENGING;
	}

	private String catchUpRecommendation(double additional, double original) {
		if (additional < original * 0.25) {
			return "Small increase needed - catch-up is very feasible";
		}
		if (additional < original * 0.5) {
			return "Moderate increase needed - catch-up is feasible with some adjustment";
		}
		if (additional < original) {
			return "Significant increase needed - consider extending timeline or reducing target";
		}
		return "Major increase needed - timeline extension or target reduction strongly recommended";
	}

	public record Requirements(
			double targetAmount,
			double inflationAdjustedTarget,
			double currentAmount,
			double futureValueCurrent,
			double remainingNeed,
			double requiredMonthly,
			double requiredAnnual,
			double lumpSumToday,
			double presentValueFutureContributions,
			double totalFundingRequired,
			double fundingPercentage,
			double yearsToGoal,
			double expectedReturn,
			double inflationRate,
			double realReturn
	) {
	}

	public record CatchUp(
			double yearsBehindSchedule,
			double yearsRemaining,
			double expectedCurrentAmount,
			double actualCurrentAmount,
			double shortfall,
			double originalRequiredMonthly,
			double catchUpRequiredMonthly,
			double additionalMonthlyNeeded,
			double catchUpPercentage,
			CatchUpFeasibility feasibility,
			String recommendation
	) {
	}

	public record Timeline(
			TimelineStatus status,
			double optimalMonthlyContribution,
			double originalYears,
			double requiredYears,
			double additionalYears,
			double projectedValue,
			double surplus,
			double shortfall,
			String recommendation
	) {
	}
}
