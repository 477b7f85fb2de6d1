package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.model.GoalProjection;
import my.goalplanner.app.support.TestProperties;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RequiredContributionSolverTest {
	private final MonteCarloEngine engine = new MonteCarloEngine(TestProperties.defaults());
	private final SuccessProbabilityCalculator calculator = new SuccessProbabilityCalculator(engine);

	@AfterEach
	void shutdown() {
		engine.shutdown();
	}

	@Test
	void solvedContributionReachesTargetProbability() {
		RequiredContributionSolver solver = new RequiredContributionSolver(calculator, TestProperties.defaults());
		GoalProjection projection = new GoalProjection(500_000, 50_000, 0, 20, 0.07, 0.15);

		RequiredContributionSolver.Result result = solver.solve(projection, 0.9, new Well19937c(7L));

		assertThat(result.converged()).isTrue();
		assertThat(result.requiredMonthly()).isPositive();
		assertThat(result.requiredAnnual()).isCloseTo(result.requiredMonthly() * 12, within(1e-9));
		assertThat(result.estimatedSuccessProbability()).isCloseTo(0.9, within(0.025));
		assertThat(result.totalContributions()).isCloseTo(result.requiredMonthly() * 240, within(1e-6));
		assertThat(result.contributionPercentage())
				.isCloseTo(result.totalContributions() / 500_000 * 100, within(1e-9));
		assertThat(result.searchSteps()).isPositive();
	}

	@Test
	void higherTargetProbabilityNeedsMoreSavings() {
		RequiredContributionSolver solver = new RequiredContributionSolver(calculator, TestProperties.defaults());
		GoalProjection projection = new GoalProjection(250_000, 10_000, 0, 12, 0.07, 0.15);

		double relaxed = solver.solve(projection, 0.6, new Well19937c(3L)).requiredMonthly();
		double strict = solver.solve(projection, 0.95, new Well19937c(3L)).requiredMonthly();

		assertThat(strict).isGreaterThan(relaxed);
	}

	@Test
	void noTimeLeftRequiresTheWholeShortfall() {
		RequiredContributionSolver solver = new RequiredContributionSolver(calculator, TestProperties.defaults());

		RequiredContributionSolver.Result result = solver.solve(
				new GoalProjection(100_000, 40_000, 0, 0, 0.07, 0.15), 0.9, new Well19937c(1L));

		assertThat(result.requiredMonthly()).isEqualTo(60_000.0);
		assertThat(result.estimatedSuccessProbability()).isEqualTo(0.0);
		assertThat(result.yearsToGoal()).isEqualTo(0.0);
	}

	@Test
	void noTimeLeftAndFundedRequiresNothing() {
		RequiredContributionSolver solver = new RequiredContributionSolver(calculator, TestProperties.defaults());

		RequiredContributionSolver.Result result = solver.solve(
				new GoalProjection(100_000, 150_000, 0, 0, 0.07, 0.15), 0.9, new Well19937c(1L));

		assertThat(result.requiredMonthly()).isEqualTo(0.0);
		assertThat(result.estimatedSuccessProbability()).isEqualTo(1.0);
	}

	@Test
	void alreadyFundedGoalNeedsNoContribution() {
		RequiredContributionSolver solver = new RequiredContributionSolver(calculator, TestProperties.defaults());

		RequiredContributionSolver.Result result = solver.solve(
				new GoalProjection(500_000, 1_000_000, 0, 10, 0.07, 0.15), 0.9, new Well19937c(9L));

		assertThat(result.requiredMonthly()).isEqualTo(0.0);
		assertThat(result.converged()).isTrue();
		assertThat(result.searchSteps()).isZero();
		assertThat(result.estimatedSuccessProbability()).isGreaterThan(0.9);
	}

	@Test
	void stopsAtStepLimitWithoutConverging() {
		AppProperties properties = TestProperties.withSolver(new AppProperties.Solver(1000, 1000, 0.01, 2, 3.0, 5));
		RequiredContributionSolver solver = new RequiredContributionSolver(calculator, properties);

		RequiredContributionSolver.Result result = solver.solve(
				new GoalProjection(500_000, 50_000, 0, 20, 0.07, 0.15), 0.9, new Well19937c(7L));

		assertThat(result.converged()).isFalse();
		assertThat(result.searchSteps()).isEqualTo(2);
		assertThat(result.requiredMonthly()).isPositive();
	}
}
