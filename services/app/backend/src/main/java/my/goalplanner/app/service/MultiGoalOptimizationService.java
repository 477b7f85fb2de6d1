package my.goalplanner.app.service;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.dto.GoalPortfolioDto;
import my.goalplanner.app.dto.MultiGoalOptimizationResultDto;
import my.goalplanner.app.model.Account;
import my.goalplanner.app.model.AccountAllocation;
import my.goalplanner.app.model.AssetClassCode;
import my.goalplanner.app.model.CapitalMarketAssumptions;
import my.goalplanner.app.model.Goal;
import my.goalplanner.app.model.GoalPortfolio;
import my.goalplanner.app.model.HouseholdStats;
import my.goalplanner.app.model.PlacementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static my.goalplanner.app.service.util.MoneyRounding.money;
import static my.goalplanner.app.service.util.MoneyRounding.rate;

/**
 * Household entry point: capital split across goals, per-goal glide-path portfolios, tax-aware
 * placement into accounts and the household roll-up.
 */
@Service
@Validated
public class MultiGoalOptimizationService {
	private static final Logger logger = LoggerFactory.getLogger(MultiGoalOptimizationService.class);

	private final GoalCapitalAllocator capitalAllocator;
	private final GlidePathAllocator glidePathAllocator;
	private final AccountPlacementOptimizer placementOptimizer;
	private final HouseholdAggregator householdAggregator;
	private final CapitalMarketAssumptions assumptions;
	private final AppProperties properties;

	public MultiGoalOptimizationService(GoalCapitalAllocator capitalAllocator,
										GlidePathAllocator glidePathAllocator,
										AccountPlacementOptimizer placementOptimizer,
										HouseholdAggregator householdAggregator,
										CapitalMarketAssumptions assumptions,
										AppProperties properties) {
		this.capitalAllocator = capitalAllocator;
		this.glidePathAllocator = glidePathAllocator;
		this.placementOptimizer = placementOptimizer;
		this.householdAggregator = householdAggregator;
		this.assumptions = assumptions;
		this.properties = properties;
	}

	public Map<String, BigDecimal> allocateCapitalToGoals(@NotEmpty List<@Valid @NotNull Goal> goals,
														  @NotNull @PositiveOrZero BigDecimal totalCapital) {
		return capitalAllocator.allocateCapital(goals, totalCapital);
	}

	public Map<String, BigDecimal> allocateMonthlySavings(@NotEmpty List<@Valid @NotNull Goal> goals,
														  @NotNull @PositiveOrZero BigDecimal totalMonthlySavings) {
		return capitalAllocator.allocateMonthlySavings(goals, totalMonthlySavings,
				properties.planning().defaultExpectedReturn());
	}

	public GoalPortfolio buildGoalPortfolio(@Valid @NotNull Goal goal,
											@NotNull @PositiveOrZero BigDecimal allocatedAmount) {
		return glidePathAllocator.buildPortfolio(goal, allocatedAmount, assumptions);
	}

	public PlacementResult placeAssetsInAccounts(@NotNull List<@NotNull GoalPortfolio> goalPortfolios,
												 @NotNull List<@Valid @NotNull Account> accounts) {
		return placementOptimizer.place(goalPortfolios, accounts);
	}

	public HouseholdStats aggregateHousehold(@NotNull List<@NotNull GoalPortfolio> goalPortfolios,
											 @NotNull Map<String, BigDecimal> goalAllocations) {
		return householdAggregator.aggregate(goalPortfolios, goalAllocations);
	}

	public MultiGoalOptimizationResultDto optimizeHousehold(@NotEmpty List<@Valid @NotNull Goal> goals,
															@NotNull @PositiveOrZero BigDecimal totalCapital,
															@NotNull List<@Valid @NotNull Account> accounts) {
		Map<String, BigDecimal> goalAllocations = capitalAllocator.allocateCapital(goals, totalCapital);
		List<GoalPortfolio> portfolios = new ArrayList<>();
		for (Goal goal : goals) {
			portfolios.add(glidePathAllocator.buildPortfolio(goal, goalAllocations.get(goal.id()), assumptions));
		}
		PlacementResult placement = placementOptimizer.place(portfolios, accounts);
		HouseholdStats stats = householdAggregator.aggregate(portfolios, goalAllocations);
		double taxDrag = householdAggregator.taxDrag(placement, assumptions);
		double locationEfficiency = householdAggregator.locationEfficiency(placement, assumptions);
		boolean rebalancingNeeded = householdAggregator.rebalancingNeeded(accounts, placement);
		List<String> recommendations = householdAggregator.recommendations(stats, locationEfficiency, taxDrag,
				rebalancingNeeded);

		logger.info("Optimized household: {} goals, {} accounts, total {} (return={}, risk={}, unplaced={}).",
				goals.size(), accounts.size(), stats.totalValue(), rate(stats.weightedReturn()),
				rate(stats.weightedRisk()), placement.totalUnplaced());

		return new MultiGoalOptimizationResultDto(
				money(stats.totalValue()),
				rate(stats.weightedReturn()),
				rate(stats.weightedRisk()),
				rate(stats.sharpeRatio()),
				roundAmounts(goalAllocations),
				portfolios.stream().map(this::toDto).toList(),
				accountAmounts(placement),
				assetAmounts(placement.unplaced()),
				assetWeights(stats.aggregateAllocation()),
				rate(taxDrag),
				rate(locationEfficiency),
				rate(stats.diversificationScore()),
				rebalancingNeeded,
				recommendations);
	}

	private GoalPortfolioDto toDto(GoalPortfolio portfolio) {
		return new GoalPortfolioDto(
				portfolio.getGoalId(),
				portfolio.getGoalName(),
				money(portfolio.getAllocatedAmount()),
				rate(portfolio.getRiskTolerance()),
				assetWeights(portfolio.getWeights()),
				rate(portfolio.getExpectedReturn()),
				rate(portfolio.getExpectedRisk()),
				rate(portfolio.getSharpeRatio()));
	}

	private Map<String, BigDecimal> roundAmounts(Map<String, BigDecimal> amounts) {
		Map<String, BigDecimal> rounded = new LinkedHashMap<>();
		amounts.forEach((key, value) -> rounded.put(key, money(value)));
		return rounded;
	}

	private Map<String, Map<String, BigDecimal>> accountAmounts(PlacementResult placement) {
		Map<String, Map<String, BigDecimal>> result = new LinkedHashMap<>();
		for (AccountAllocation allocation : placement.accountAllocations().values()) {
			result.put(allocation.accountId(), assetAmounts(allocation.amounts()));
		}
		return result;
	}

	private Map<String, BigDecimal> assetAmounts(Map<AssetClassCode, BigDecimal> amounts) {
		Map<String, BigDecimal> result = new LinkedHashMap<>();
		amounts.forEach((code, value) -> result.put(code.getKey(), money(value)));
		return result;
	}

	private Map<String, Double> assetWeights(Map<AssetClassCode, Double> weights) {
		Map<String, Double> result = new LinkedHashMap<>();
		weights.forEach((code, value) -> result.put(code.getKey(), rate(value)));
		return result;
	}
}
