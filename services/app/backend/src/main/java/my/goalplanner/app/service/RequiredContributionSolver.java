package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.model.GoalProjection;
import my.goalplanner.app.model.SimulationResult;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Binary-searches the smallest monthly contribution whose simulated success probability reaches
 * a target.
 *
 * <p>All search steps replay the same path seed, so the probability is monotone in the
 * contribution and the bisection cannot oscillate on sampling noise. The final contribution is
 * re-simulated with a fresh seed at the verification iteration count.
 */
@Service
public class RequiredContributionSolver {
	private static final Logger logger = LoggerFactory.getLogger(RequiredContributionSolver.class);

	private final SuccessProbabilityCalculator calculator;
	private final AppProperties.Solver settings;

	public RequiredContributionSolver(SuccessProbabilityCalculator calculator, AppProperties properties) {
		this.calculator = calculator;
		this.settings = properties.solver();
	}

	public Result solve(GoalProjection projection, double targetProbability, RandomGenerator random) {
		double target = projection.targetAmount();
		double current = projection.currentAmount();
		double years = projection.yearsToGoal();
		if (years <= 0) {
			double shortfall = Math.max(0.0, target - current);
			return new Result(shortfall, shortfall, targetProbability, shortfall == 0 ? 1.0 : 0.0,
					current, 0.0, shortfall, target > 0 ? shortfall / target * 100 : 0.0, 0, true);
		}

		double months = years * 12;
		double initialGuess = initialGuess(projection, months);
		long searchSeed = random.nextLong();
		long verificationSeed = random.nextLong();

		double low = 0.0;
		double high = initialGuess * settings.bracketMultiplier();
		if (high <= 0) {
			if (probabilityAt(projection, 0.0, searchSeed) >= targetProbability) {
				return verify(projection, 0.0, targetProbability, months, verificationSeed, 0, true);
			}
			high = target / months;
		}
		int expansions = 0;
		while (expansions < settings.maxBracketExpansions()
				&& probabilityAt(projection, high, searchSeed) < targetProbability) {
			low = high;
			high = high * 2;
			expansions++;
			logger.debug("Expanded contribution bracket to [{}, {}]", low, high);
		}

		int steps = 0;
		while (high - low > settings.toleranceAmount() && steps < settings.maxSteps()) {
			double mid = (low + high) / 2;
			double probability = probabilityAt(projection, mid, searchSeed);
			steps++;
			logger.debug("Search step {}: contribution={} probability={}", steps, mid, probability);
			if (probability < targetProbability) {
				low = mid;
			} else {
				high = mid;
			}
		}
		boolean converged = high - low <= settings.toleranceAmount();
		if (!converged) {
			logger.warn("Required contribution search stopped after {} steps without converging (bracket [{}, {}]).",
					steps, low, high);
		}
		return verify(projection, (low + high) / 2, targetProbability, months, verificationSeed, steps, converged);
	}

	private double initialGuess(GoalProjection projection, double months) {
		double monthlyRate = projection.expectedReturn() / 12;
		double futureValueCurrent = projection.currentAmount() * FastMath.pow(1 + monthlyRate, months);
		double remaining = projection.targetAmount() - futureValueCurrent;
		if (remaining > 0 && monthlyRate > 0) {
			return FundingCalculator.annuityPayment(remaining, monthlyRate, months);
		}
		return Math.max(0.0, remaining / months);
	}

	private double probabilityAt(GoalProjection projection, double contribution, long seed) {
		return calculator.probability(projection.withMonthlyContribution(contribution),
				settings.searchIterations(), new Well19937c(seed));
	}

	private Result verify(GoalProjection projection, double monthly, double targetProbability, double months,
						  long seed, int steps, boolean converged) {
		SimulationResult verification = calculator.calculate(projection.withMonthlyContribution(monthly),
				settings.verificationIterations(), new Well19937c(seed));
		double totalContributions = monthly * months;
		double contributionPercentage = projection.targetAmount() > 0
				? totalContributions / projection.targetAmount() * 100
				: 0.0;
		return new Result(monthly, monthly * 12, targetProbability, verification.successProbability(),
				verification.medianOutcome(), projection.yearsToGoal(), totalContributions, contributionPercentage,
				steps, converged);
	}

	public record Result(
			double requiredMonthly,
			double requiredAnnual,
			double targetProbability,
			double estimatedSuccessProbability,
			double medianOutcome,
			double yearsToGoal,
			double totalContributions,
			double contributionPercentage,
			int searchSteps,
			boolean converged
	) {
	}
}
