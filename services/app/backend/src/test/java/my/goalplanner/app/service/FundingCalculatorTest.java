package my.goalplanner.app.service;

import my.goalplanner.app.model.CatchUpFeasibility;
import my.goalplanner.app.model.TimelineStatus;
import my.goalplanner.app.support.TestProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FundingCalculatorTest {
	private final FundingCalculator calculator = new FundingCalculator(TestProperties.defaults());

	@Test
	void overFundedGoalNeedsNoSavings() {
		FundingCalculator.Requirements result = calculator.requirements(100_000, 150_000, 10, 0.07, 0.03);

		assertThat(result.remainingNeed()).isEqualTo(0.0);
		assertThat(result.requiredMonthly()).isLessThanOrEqualTo(0.0);
		assertThat(result.requiredAnnual()).isLessThanOrEqualTo(0.0);
		assertThat(result.lumpSumToday()).isEqualTo(0.0);
		assertThat(result.fundingPercentage()).isEqualTo(100.0);
	}

	@Test
	void computesLevelMonthlyPayment() {
		FundingCalculator.Requirements result = calculator.requirements(100_000, 0, 10, 0.06, 0.0);

		assertThat(result.requiredMonthly()).isCloseTo(610.205, within(0.001));
		assertThat(result.inflationAdjustedTarget()).isEqualTo(100_000.0);
		assertThat(result.lumpSumToday()).isCloseTo(100_000 / Math.pow(1.06, 10), within(1e-6));
		assertThat(result.fundingPercentage()).isEqualTo(0.0);
	}

	@Test
	void fallsBackToLinearSavingsWithoutGrowth() {
		FundingCalculator.Requirements result = calculator.requirements(120_000, 0, 10, 0.0, 0.0);

		assertThat(result.requiredMonthly()).isCloseTo(1000.0, within(1e-9));
		assertThat(result.requiredAnnual()).isCloseTo(12_000.0, within(1e-9));
		assertThat(result.presentValueFutureContributions()).isCloseTo(120_000.0, within(1e-6));
		assertThat(result.totalFundingRequired()).isCloseTo(120_000.0, within(1e-6));
	}

	@Test
	void inflatesTargetAndReportsRealReturn() {
		FundingCalculator.Requirements result = calculator.requirements(100_000, 20_000, 15, 0.07, 0.03);

		assertThat(result.inflationAdjustedTarget()).isCloseTo(100_000 * Math.pow(1.03, 15), within(1e-6));
		assertThat(result.futureValueCurrent()).isCloseTo(20_000 * Math.pow(1.07, 15), within(1e-6));
		assertThat(result.realReturn()).isCloseTo(1.07 / 1.03 - 1, within(1e-12));
		assertThat(result.fundingPercentage()).isBetween(0.0, 100.0);
	}

	@Test
	void noTimeLeftNeedsTheWholeGapNow() {
		FundingCalculator.Requirements result = calculator.requirements(50_000, 30_000, 0, 0.07, 0.03);

		assertThat(result.requiredMonthly()).isEqualTo(20_000.0);
		assertThat(result.requiredAnnual()).isEqualTo(20_000.0);
		assertThat(result.lumpSumToday()).isEqualTo(20_000.0);
		assertThat(result.presentValueFutureContributions()).isEqualTo(0.0);
	}

	@Test
	void catchUpForGoalHalfwayBehind() {
		FundingCalculator.CatchUp result = calculator.catchUp(100_000, 10_000, 5, 5, 0.07);

		assertThat(result.expectedCurrentAmount()).isCloseTo(50_000.0, within(1e-9));
		assertThat(result.shortfall()).isCloseTo(40_000.0, within(1e-9));
		assertThat(result.originalRequiredMonthly()).isCloseTo(776.45, within(0.01));
		assertThat(result.catchUpRequiredMonthly()).isCloseTo(1423.35, within(0.01));
		assertThat(result.additionalMonthlyNeeded()).isCloseTo(646.90, within(0.01));
		assertThat(result.catchUpPercentage()).isCloseTo(83.32, within(0.01));
		assertThat(result.feasibility()).isEqualTo(CatchUpFeasibility.MEDIUM);
		assertThat(result.recommendation()).startsWith("Significant increase needed");
	}

	@Test
	void catchUpWithoutTimelineHasNoExpectedProgress() {
		FundingCalculator.CatchUp result = calculator.catchUp(100_000, 0, 0, 0, 0.07);

		assertThat(result.expectedCurrentAmount()).isEqualTo(0.0);
		assertThat(result.catchUpPercentage()).isEqualTo(0.0);
	}

	@Test
	void timelineWithinBudgetIsAchievable() {
		FundingCalculator.Timeline result = calculator.timeline(100_000, 50_000, 10, 1000, 0.07);

		assertThat(result.status()).isEqualTo(TimelineStatus.ACHIEVABLE);
		assertThat(result.projectedValue()).isCloseTo(273_567.88, within(0.01));
		assertThat(result.optimalMonthlyContribution()).isCloseTo(208.19, within(0.01));
		assertThat(result.surplus()).isCloseTo(173_567.88, within(0.01));
	}

	@Test
	void timelineBeyondBudgetIsExtended() {
		FundingCalculator.Timeline result = calculator.timeline(1_000_000, 0, 10, 1000, 0.07);

		assertThat(result.status()).isEqualTo(TimelineStatus.TIMELINE_EXTENSION_NEEDED);
		assertThat(result.projectedValue()).isCloseTo(173_084.81, within(0.01));
		assertThat(result.requiredYears()).isCloseTo(27.54, within(0.1));
		assertThat(result.additionalYears()).isCloseTo(result.requiredYears() - 10, within(1e-9));
		assertThat(result.shortfall()).isCloseTo(1_000_000 - 173_084.81, within(0.01));
	}

	@Test
	void timelineWithoutContributionsOrSavingsNeverArrives() {
		FundingCalculator.Timeline result = calculator.timeline(100_000, 0, 10, 0, 0.07);

		assertThat(result.requiredYears()).isInfinite();
	}

	@Test
	void timelineWithoutContributionsUsesGrowthOnly() {
		FundingCalculator.Timeline result = calculator.timeline(100_000, 50_000, 5, 0, 0.07);

		assertThat(result.requiredYears()).isCloseTo(Math.log(2) / Math.log(1.07), within(1e-9));
	}
}
