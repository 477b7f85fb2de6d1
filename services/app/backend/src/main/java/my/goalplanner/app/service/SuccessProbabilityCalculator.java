package my.goalplanner.app.service;

import my.goalplanner.app.model.GoalProjection;
import my.goalplanner.app.model.SimulationResult;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.Arrays;

@Service
public class SuccessProbabilityCalculator {
	private final MonteCarloEngine engine;

	public SuccessProbabilityCalculator(MonteCarloEngine engine) {
		this.engine = engine;
	}

	public SimulationResult calculate(GoalProjection projection, int iterations, RandomGenerator random) {
		double target = projection.targetAmount();
		double current = projection.currentAmount();
		if (projection.yearsToGoal() <= 0) {
			double probability = current >= target ? 1.0 : 0.0;
			return new SimulationResult(probability, current, current, current, current, current,
					current, 0.0, 1.0 - probability, Math.max(0.0, target - current), target, iterations);
		}
		double[] terminalValues = engine.simulate(projection, iterations, random);
		return summarize(terminalValues, target);
	}

	public double probability(GoalProjection projection, int iterations, RandomGenerator random) {
		if (projection.yearsToGoal() <= 0) {
			return projection.currentAmount() >= projection.targetAmount() ? 1.0 : 0.0;
		}
		double[] terminalValues = engine.simulate(projection, iterations, random);
		return successShare(terminalValues, projection.targetAmount());
	}

	SimulationResult summarize(double[] terminalValues, double target) {
		int count = terminalValues.length;
		double probability = successShare(terminalValues, target);

		Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
		percentile.setData(terminalValues);
		double median = percentile.evaluate(50.0);
		double p10 = percentile.evaluate(10.0);
		double p25 = percentile.evaluate(25.0);
		double p75 = percentile.evaluate(75.0);
		double p90 = percentile.evaluate(90.0);

		double mean = StatUtils.mean(terminalValues);
		double deviation = FastMath.sqrt(StatUtils.populationVariance(terminalValues, mean));

		double[] shortfalls = Arrays.stream(terminalValues)
				.filter(value -> value < target)
				.map(value -> target - value)
				.toArray();
		double medianShortfall = shortfalls.length == 0
				? 0.0
				: new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(shortfalls, 50.0);

		return new SimulationResult(probability, median, p10, p25, p75, p90, mean, deviation,
				1.0 - probability, medianShortfall, target, count);
	}

	private double successShare(double[] terminalValues, double target) {
		int successes = 0;
		for (double value : terminalValues) {
			if (value >= target) {
				successes++;
			}
		}
		return (double) successes / terminalValues.length;
	}
}
