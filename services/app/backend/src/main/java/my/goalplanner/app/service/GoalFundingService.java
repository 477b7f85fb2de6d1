package my.goalplanner.app.service;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.dto.CatchUpStrategyDto;
import my.goalplanner.app.dto.CatchUpStrategyRequest;
import my.goalplanner.app.dto.ContributionTimelineDto;
import my.goalplanner.app.dto.ContributionTimelineRequest;
import my.goalplanner.app.dto.FundingRequirementsDto;
import my.goalplanner.app.dto.FundingRequirementsRequest;
import my.goalplanner.app.dto.RequiredContributionDto;
import my.goalplanner.app.dto.RequiredContributionRequest;
import my.goalplanner.app.dto.SimulationResultDto;
import my.goalplanner.app.dto.SuccessProbabilityRequest;
import my.goalplanner.app.model.GoalProjection;
import my.goalplanner.app.model.SimulationResult;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import static my.goalplanner.app.service.util.MoneyRounding.money;
import static my.goalplanner.app.service.util.MoneyRounding.rate;
import static my.goalplanner.app.service.util.MoneyRounding.round;

/**
 * Single-goal funding entry point. Requests are validated before they reach the calculators;
 * results are rounded here and nowhere else.
 */
@Service
@Validated
public class GoalFundingService {
	private static final Logger logger = LoggerFactory.getLogger(GoalFundingService.class);
	private static final double DEFAULT_TARGET_PROBABILITY = 0.9;

	private final FundingCalculator fundingCalculator;
	private final SuccessProbabilityCalculator probabilityCalculator;
	private final RequiredContributionSolver contributionSolver;
	private final AppProperties properties;

	public GoalFundingService(FundingCalculator fundingCalculator,
							  SuccessProbabilityCalculator probabilityCalculator,
							  RequiredContributionSolver contributionSolver,
							  AppProperties properties) {
		this.fundingCalculator = fundingCalculator;
		this.probabilityCalculator = probabilityCalculator;
		this.contributionSolver = contributionSolver;
		this.properties = properties;
	}

	public FundingRequirementsDto computeFundingRequirements(@Valid @NotNull FundingRequirementsRequest request) {
		FundingCalculator.Requirements result = fundingCalculator.requirements(
				request.targetAmount().doubleValue(),
				request.currentAmount().doubleValue(),
				request.yearsToGoal(),
				expectedReturn(request.expectedReturn()),
				inflation(request.inflationRate()));
		return new FundingRequirementsDto(
				money(request.targetAmount()),
				money(result.inflationAdjustedTarget()),
				money(request.currentAmount()),
				money(result.futureValueCurrent()),
				money(result.remainingNeed()),
				money(result.requiredMonthly()),
				money(result.requiredAnnual()),
				money(result.lumpSumToday()),
				money(result.presentValueFutureContributions()),
				money(result.totalFundingRequired()),
				round(result.fundingPercentage(), 2),
				result.yearsToGoal(),
				result.expectedReturn(),
				result.inflationRate(),
				rate(result.realReturn()));
	}

	public SimulationResultDto computeSuccessProbability(@Valid @NotNull SuccessProbabilityRequest request) {
		GoalProjection projection = new GoalProjection(
				request.targetAmount().doubleValue(),
				request.currentAmount().doubleValue(),
				request.monthlyContribution().doubleValue(),
				request.yearsToGoal(),
				expectedReturn(request.expectedReturn()),
				volatility(request.returnVolatility()));
		int iterations = request.iterations() == null
				? properties.simulation().defaultIterations()
				: request.iterations();
		SimulationResult result = probabilityCalculator.calculate(projection, iterations, random(request.seed()));
		logger.debug("Simulated {} paths over {} years: success probability {}.", iterations,
				request.yearsToGoal(), result.successProbability());
		return new SimulationResultDto(
				rate(result.successProbability()),
				money(result.medianOutcome()),
				money(result.percentile10()),
				money(result.percentile25()),
				money(result.percentile75()),
				money(result.percentile90()),
				money(result.expectedValue()),
				money(result.standardDeviation()),
				rate(result.shortfallRisk()),
				money(result.medianShortfall()),
				money(request.targetAmount()),
				iterations);
	}

	public RequiredContributionDto computeRequiredContribution(@Valid @NotNull RequiredContributionRequest request) {
		GoalProjection projection = new GoalProjection(
				request.targetAmount().doubleValue(),
				request.currentAmount().doubleValue(),
				0.0,
				request.yearsToGoal(),
				expectedReturn(request.expectedReturn()),
				volatility(request.returnVolatility()));
		double targetProbability = request.targetProbability() == null
				? DEFAULT_TARGET_PROBABILITY
				: request.targetProbability();
		RequiredContributionSolver.Result result = contributionSolver.solve(projection, targetProbability,
				random(request.seed()));
		return new RequiredContributionDto(
				money(result.requiredMonthly()),
				money(result.requiredAnnual()),
				result.targetProbability(),
				rate(result.estimatedSuccessProbability()),
				money(result.medianOutcome()),
				result.yearsToGoal(),
				money(result.totalContributions()),
				round(result.contributionPercentage(), 2),
				result.searchSteps(),
				result.converged());
	}

	public CatchUpStrategyDto computeCatchUpStrategy(@Valid @NotNull CatchUpStrategyRequest request) {
		FundingCalculator.CatchUp result = fundingCalculator.catchUp(
				request.targetAmount().doubleValue(),
				request.currentAmount().doubleValue(),
				request.yearsRemaining(),
				request.yearsBehindSchedule(),
				expectedReturn(request.expectedReturn()));
		return new CatchUpStrategyDto(
				result.yearsBehindSchedule(),
				result.yearsRemaining(),
				money(result.expectedCurrentAmount()),
				money(request.currentAmount()),
				money(result.shortfall()),
				money(result.originalRequiredMonthly()),
				money(result.catchUpRequiredMonthly()),
				money(result.additionalMonthlyNeeded()),
				round(result.catchUpPercentage(), 2),
				result.feasibility(),
				result.recommendation());
	}

	public ContributionTimelineDto computeContributionTimeline(@Valid @NotNull ContributionTimelineRequest request) {
		FundingCalculator.Timeline result = fundingCalculator.timeline(
				request.targetAmount().doubleValue(),
				request.currentAmount().doubleValue(),
				request.yearsToGoal(),
				request.maxMonthlyContribution().doubleValue(),
				expectedReturn(request.expectedReturn()));
		return new ContributionTimelineDto(
				result.status(),
				money(result.optimalMonthlyContribution()),
				result.originalYears(),
				round(result.requiredYears(), 2),
				round(result.additionalYears(), 2),
				money(result.projectedValue()),
				money(result.surplus()),
				money(result.shortfall()),
				result.recommendation());
	}

	private double expectedReturn(Double value) {
		return value == null ? properties.planning().defaultExpectedReturn() : value;
	}

	private double volatility(Double value) {
		return value == null ? properties.planning().defaultVolatility() : value;
	}

	private double inflation(Double value) {
		return value == null ? properties.planning().defaultInflation() : value;
	}

	private RandomGenerator random(Long seed) {
		return seed == null ? new Well19937c() : new Well19937c(seed);
	}
}
