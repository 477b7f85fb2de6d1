package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.model.Account;
import my.goalplanner.app.model.AccountAllocation;
import my.goalplanner.app.model.AccountType;
import my.goalplanner.app.model.AssetClassCode;
import my.goalplanner.app.model.CapitalMarketAssumptions;
import my.goalplanner.app.model.GoalPortfolio;
import my.goalplanner.app.model.HouseholdStats;
import my.goalplanner.app.model.PlacementResult;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class HouseholdAggregator {
	static final double LOCATION_EFFICIENCY_FLOOR = 0.7;
	static final double DIVERSIFICATION_FLOOR = 0.6;
	static final double TAX_DRAG_CEILING = 0.015;
	static final double SHARPE_FLOOR = 0.5;
	private static final double TAX_EXEMPT_LOCATION_SCORE = 0.9;

	private final double riskFreeRate;
	private final double driftThreshold;

	public HouseholdAggregator(AppProperties properties) {
		this.riskFreeRate = properties.glidePath().riskFreeRate();
		this.driftThreshold = properties.planning().driftThreshold();
	}

	/**
	 * Capital-weighted household statistics. Portfolios whose goal has no entry in
	 * {@code goalAllocations} are skipped; each goal may have at most one portfolio.
	 */
	public HouseholdStats aggregate(List<GoalPortfolio> portfolios, Map<String, BigDecimal> goalAllocations) {
		if (portfolios == null || portfolios.isEmpty() || goalAllocations == null || goalAllocations.isEmpty()) {
			return HouseholdStats.empty();
		}
		Set<String> portfolioGoals = new HashSet<>();
		for (GoalPortfolio portfolio : portfolios) {
			if (!portfolioGoals.add(portfolio.getGoalId())) {
				throw new GoalPlanningException("Duplicate portfolio for goal: " + portfolio.getGoalId(),
						GoalPlanningException.GOAL_DUPLICATE);
			}
		}
		for (Map.Entry<String, BigDecimal> entry : goalAllocations.entrySet()) {
			if (entry.getValue() != null && entry.getValue().signum() > 0 && !portfolioGoals.contains(entry.getKey())) {
				throw new GoalPlanningException("Allocation refers to goal without a portfolio: " + entry.getKey(),
						GoalPlanningException.GOAL_MISSING);
			}
		}

		BigDecimal total = BigDecimal.ZERO;
		for (GoalPortfolio portfolio : portfolios) {
			BigDecimal allocated = goalAllocations.get(portfolio.getGoalId());
			if (allocated != null && allocated.signum() > 0) {
				total = total.add(allocated);
			}
		}
		if (total.signum() == 0) {
			return new HouseholdStats(BigDecimal.ZERO, 0.0, 0.0, 0.0, Map.of(), 0.0);
		}

		double totalValue = total.doubleValue();
		double weightedReturn = 0.0;
		double weightedRisk = 0.0;
		Map<AssetClassCode, Double> allocation = new EnumMap<>(AssetClassCode.class);
		for (GoalPortfolio portfolio : portfolios) {
			BigDecimal allocated = goalAllocations.get(portfolio.getGoalId());
			if (allocated == null || allocated.signum() <= 0) {
				continue;
			}
			double share = allocated.doubleValue() / totalValue;
			weightedReturn += share * portfolio.getExpectedReturn();
			weightedRisk += share * portfolio.getExpectedRisk();
			for (Map.Entry<AssetClassCode, Double> weight : portfolio.getWeights().entrySet()) {
				allocation.merge(weight.getKey(), share * weight.getValue(), Double::sum);
			}
		}
		double sharpe = weightedRisk > 0 ? (weightedReturn - riskFreeRate) / weightedRisk : 0.0;
		return new HouseholdStats(total, weightedReturn, weightedRisk, sharpe,
				Collections.unmodifiableMap(allocation), diversificationScore(allocation));
	}

	/**
	 * 1 minus the normalized Herfindahl index of the non-zero weights.
	 */
	public double diversificationScore(Map<AssetClassCode, Double> allocation) {
		List<Double> weights = new ArrayList<>();
		for (Double weight : allocation.values()) {
			if (weight != null && weight > 0) {
				weights.add(weight);
			}
		}
		if (weights.isEmpty()) {
			return 0.0;
		}
		int n = weights.size();
		if (n == 1) {
			return 1.0;
		}
		double hhi = 0.0;
		for (double weight : weights) {
			hhi += weight * weight;
		}
		double minHhi = 1.0 / n;
		return 1.0 - (hhi - minHhi) / (1.0 - minHhi);
	}

	/**
	 * Annual return lost to taxes, as a fraction of everything placed. Only taxable accounts drag.
	 */
	public double taxDrag(PlacementResult placement, CapitalMarketAssumptions assumptions) {
		double drag = 0.0;
		double placed = 0.0;
		for (AccountAllocation allocation : placement.accountAllocations().values()) {
			for (Map.Entry<AssetClassCode, BigDecimal> entry : allocation.amounts().entrySet()) {
				double amount = entry.getValue().doubleValue();
				placed += amount;
				if (allocation.accountType() == AccountType.TAXABLE) {
					drag += (1 - assumptions.taxEfficiency(entry.getKey()))
							* assumptions.expectedReturn(entry.getKey()) * amount;
				}
			}
		}
		return placed > 0 ? drag / placed : 0.0;
	}

	public double locationEfficiency(PlacementResult placement, CapitalMarketAssumptions assumptions) {
		double score = 0.0;
		double placed = 0.0;
		for (AccountAllocation allocation : placement.accountAllocations().values()) {
			for (Map.Entry<AssetClassCode, BigDecimal> entry : allocation.amounts().entrySet()) {
				double amount = entry.getValue().doubleValue();
				double efficiency = assumptions.taxEfficiency(entry.getKey());
				double assetScore = switch (allocation.accountType()) {
					case TAX_DEFERRED -> 1.0 - efficiency;
					case TAX_EXEMPT -> TAX_EXEMPT_LOCATION_SCORE;
					case TAXABLE -> efficiency;
				};
				score += assetScore * amount;
				placed += amount;
			}
		}
		return placed > 0 ? score / placed : 0.0;
	}

	/**
	 * True when any account's target holding of an asset class differs from its current holding
	 * by more than the drift threshold, measured as a share of the account balance.
	 */
	public boolean rebalancingNeeded(List<Account> accounts, PlacementResult placement) {
		for (Account account : accounts) {
			if (account.balance() == null || account.balance().signum() <= 0) {
				continue;
			}
			AccountAllocation target = placement.accountAllocations().get(account.id());
			Map<AssetClassCode, BigDecimal> targetAmounts = target == null ? Map.of() : target.amounts();
			Map<AssetClassCode, BigDecimal> current = account.holdings();
			Set<AssetClassCode> codes = EnumSet.noneOf(AssetClassCode.class);
			codes.addAll(targetAmounts.keySet());
			codes.addAll(current.keySet());
			double balance = account.balance().doubleValue();
			for (AssetClassCode code : codes) {
				double targetShare = targetAmounts.getOrDefault(code, BigDecimal.ZERO).doubleValue() / balance;
				double currentShare = current.getOrDefault(code, BigDecimal.ZERO).doubleValue() / balance;
				if (Math.abs(targetShare - currentShare) > driftThreshold) {
					return true;
				}
			}
		}
		return false;
	}

	public List<String> recommendations(HouseholdStats stats, double locationEfficiency, double taxDrag,
										boolean rebalancingNeeded) {
		List<String> recommendations = new ArrayList<>();
		if (locationEfficiency < LOCATION_EFFICIENCY_FLOOR) {
			recommendations.add(String.format(Locale.ROOT,
					"Asset location efficiency is %.1f%%. Consider moving tax-inefficient assets (bonds) to tax-deferred accounts.",
					locationEfficiency * 100));
		}
		if (stats.diversificationScore() < DIVERSIFICATION_FLOOR) {
			recommendations.add(String.format(Locale.ROOT,
					"Diversification score is %.1f%%. Consider adding more asset classes to reduce concentration risk.",
					stats.diversificationScore() * 100));
		}
		if (rebalancingNeeded) {
			recommendations.add(String.format(Locale.ROOT,
					"Portfolio has drifted more than %.0f%% from targets. Consider rebalancing.",
					driftThreshold * 100));
		}
		if (taxDrag > TAX_DRAG_CEILING) {
			recommendations.add(String.format(Locale.ROOT,
					"Estimated tax drag is %.2f%% annually. Consider tax-loss harvesting and municipal bonds.",
					taxDrag * 100));
		}
		if (stats.sharpeRatio() < SHARPE_FLOOR) {
			recommendations.add(String.format(Locale.ROOT,
					"Sharpe ratio is %.2f. Risk-adjusted returns could be improved through better diversification.",
					stats.sharpeRatio()));
		}
		if (recommendations.isEmpty()) {
			recommendations.add("Portfolio is well optimized.");
		}
		return List.copyOf(recommendations);
	}
}
