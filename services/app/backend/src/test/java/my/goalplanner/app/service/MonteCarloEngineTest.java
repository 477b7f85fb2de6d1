package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.model.GoalProjection;
import my.goalplanner.app.support.TestProperties;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MonteCarloEngineTest {
	private final List<MonteCarloEngine> engines = new ArrayList<>();

	@AfterEach
	void shutdownEngines() {
		engines.forEach(MonteCarloEngine::shutdown);
	}

	@Test
	void returnsCurrentAmountWhenNoTimeIsLeft() {
		MonteCarloEngine engine = engine(500, 4);
		GoalProjection projection = new GoalProjection(100_000, 42_000, 500, 0, 0.07, 0.15);

		double[] values = engine.simulate(projection, 5000, new Well19937c(1L));

		assertThat(values).containsExactly(42_000.0);
	}

	@Test
	void zeroVolatilityMatchesClosedFormProjection() {
		MonteCarloEngine engine = engine(500, 4);
		GoalProjection projection = new GoalProjection(100_000, 10_000, 250, 5, 0.06, 0.0);

		double[] values = engine.simulate(projection, 1000, new Well19937c(3L));

		double expected = FundingCalculator.projectValue(10_000, 250, 0.06 / 12, 60);
		assertThat(values).hasSize(1000);
		for (double value : values) {
			assertThat(value).isCloseTo(expected, within(1e-6));
		}
	}

	@Test
	void sameSeedGivesSameOutcomesRegardlessOfPoolSize() {
		GoalProjection projection = new GoalProjection(500_000, 50_000, 1500, 20, 0.07, 0.15);

		double[] sequential = engine(300, 1).simulate(projection, 2000, new Well19937c(99L));
		double[] parallel = engine(300, 4).simulate(projection, 2000, new Well19937c(99L));

		assertThat(parallel).containsExactly(sequential);
	}

	@Test
	void differentSeedsGiveDifferentOutcomes() {
		MonteCarloEngine engine = engine(500, 2);
		GoalProjection projection = new GoalProjection(500_000, 50_000, 1500, 20, 0.07, 0.15);

		double[] first = engine.simulate(projection, 1000, new Well19937c(1L));
		double[] second = engine.simulate(projection, 1000, new Well19937c(2L));

		assertThat(first).isNotEqualTo(second);
	}

	@Test
	void partialLastBatchIsFilled() {
		MonteCarloEngine engine = engine(400, 3);
		GoalProjection projection = new GoalProjection(10_000, 1_000, 100, 2, 0.05, 0.1);

		double[] values = engine.simulate(projection, 1001, new Well19937c(5L));

		assertThat(values).hasSize(1001);
		assertThat(values[1000]).isPositive();
	}

	private MonteCarloEngine engine(int batchSize, int parallelism) {
		AppProperties properties = TestProperties.withSimulation(
				new AppProperties.Simulation(5000, batchSize, parallelism));
		MonteCarloEngine engine = new MonteCarloEngine(properties);
		engines.add(engine);
		return engine;
	}
}
