package my.goalplanner.app.service;

import my.goalplanner.app.model.Goal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a budget across goals. When the budget covers every need the surplus is shared in
 * proportion to need; otherwise goals are funded in priority order, earlier target dates first.
 */
@Service
public class GoalCapitalAllocator {
	private static final Logger logger = LoggerFactory.getLogger(GoalCapitalAllocator.class);
	private static final int SCALE = 2;
	private static final BigDecimal HUNDRED = new BigDecimal("100");
	private static final Comparator<Goal> FUNDING_ORDER = Comparator
			.comparingInt((Goal goal) -> goal.priority().getRank())
			.thenComparing(Goal::targetDate, Comparator.nullsLast(Comparator.naturalOrder()));

	public Map<String, BigDecimal> allocateCapital(List<Goal> goals, BigDecimal totalCapital) {
		if (goals == null || goals.isEmpty()) {
			return Map.of();
		}
		requireUniqueIds(goals);
		Map<String, BigDecimal> needs = new LinkedHashMap<>();
		for (Goal goal : goals) {
			needs.put(goal.id(), scaleByFunding(goal.shortfall(), goal));
		}
		return allocate(goals, needs, totalCapital);
	}

	/**
	 * Same rules as {@link #allocateCapital}, with each goal's need being the level monthly saving
	 * that closes its shortfall at {@code expectedReturn}, scaled by its funding percentage.
	 */
	public Map<String, BigDecimal> allocateMonthlySavings(List<Goal> goals,
														  BigDecimal totalMonthlySavings,
														  double expectedReturn) {
		if (goals == null || goals.isEmpty()) {
			return Map.of();
		}
		requireUniqueIds(goals);
		Map<String, BigDecimal> needs = new LinkedHashMap<>();
		for (Goal goal : goals) {
			double monthly = requiredMonthly(goal, expectedReturn);
			BigDecimal need = BigDecimal.valueOf(Math.max(0.0, monthly)).setScale(SCALE, RoundingMode.HALF_UP);
			needs.put(goal.id(), scaleByFunding(need, goal));
		}
		return allocate(goals, needs, totalMonthlySavings);
	}

	private Map<String, BigDecimal> allocate(List<Goal> goals, Map<String, BigDecimal> needs, BigDecimal budget) {
		BigDecimal capital = safeAmount(budget);
		BigDecimal totalNeed = needs.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);

		Map<String, BigDecimal> allocations;
		if (totalNeed.compareTo(capital) <= 0) {
			allocations = fundAllWithSurplus(needs, totalNeed, capital);
		} else {
			allocations = fundByPriority(goals, needs, capital);
		}

		Map<String, BigDecimal> ordered = new LinkedHashMap<>();
		for (Goal goal : goals) {
			ordered.put(goal.id(), allocations.getOrDefault(goal.id(), BigDecimal.ZERO));
		}
		logger.debug("Allocated {} of {} across {} goals (total need {}).",
				ordered.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add), capital, goals.size(), totalNeed);
		return Collections.unmodifiableMap(ordered);
	}

	private Map<String, BigDecimal> fundAllWithSurplus(Map<String, BigDecimal> needs,
													   BigDecimal totalNeed,
													   BigDecimal capital) {
		Map<String, BigDecimal> allocations = new LinkedHashMap<>(needs);
		BigDecimal surplus = capital.subtract(totalNeed);
		if (surplus.signum() <= 0 || totalNeed.signum() == 0) {
			return allocations;
		}
		String largestNeedId = null;
		BigDecimal largestNeed = null;
		BigDecimal distributed = BigDecimal.ZERO;
		for (Map.Entry<String, BigDecimal> entry : needs.entrySet()) {
			BigDecimal share = surplus.multiply(entry.getValue()).divide(totalNeed, SCALE, RoundingMode.DOWN);
			allocations.put(entry.getKey(), entry.getValue().add(share));
			distributed = distributed.add(share);
			if (largestNeed == null || entry.getValue().compareTo(largestNeed) > 0) {
				largestNeed = entry.getValue();
				largestNeedId = entry.getKey();
			}
		}
		BigDecimal residue = surplus.subtract(distributed);
		if (residue.signum() != 0) {
			allocations.merge(largestNeedId, residue, BigDecimal::add);
		}
		return allocations;
	}

	private Map<String, BigDecimal> fundByPriority(List<Goal> goals,
												   Map<String, BigDecimal> needs,
												   BigDecimal capital) {
		List<Goal> ordered = new ArrayList<>(goals);
		ordered.sort(FUNDING_ORDER);
		FundingState state = FundingState.start(capital);
		for (Goal goal : ordered) {
			state = state.fund(goal.id(), needs.get(goal.id()));
		}
		return state.allocations();
	}

	private double requiredMonthly(Goal goal, double expectedReturn) {
		double current = goal.currentAmount().doubleValue();
		double target = goal.targetAmount().doubleValue();
		double years = goal.yearsToGoal();
		double remaining = target - current * Math.pow(1 + expectedReturn, years);
		if (remaining <= 0) {
			return 0.0;
		}
		return FundingCalculator.annuityPayment(remaining, expectedReturn / 12, years * 12);
	}

	private BigDecimal scaleByFunding(BigDecimal amount, Goal goal) {
		return amount.multiply(goal.effectiveFundingPercentage()).divide(HUNDRED, SCALE, RoundingMode.HALF_UP);
	}

	private void requireUniqueIds(List<Goal> goals) {
		Set<String> seen = new HashSet<>();
		for (Goal goal : goals) {
			if (!seen.add(goal.id())) {
				throw new GoalPlanningException("Duplicate goal id: " + goal.id(), GoalPlanningException.GOAL_DUPLICATE);
			}
		}
	}

	private BigDecimal safeAmount(BigDecimal value) {
		if (value == null || value.signum() < 0) {
			return BigDecimal.ZERO;
		}
		return value;
	}

	private record FundingState(BigDecimal remaining, Map<String, BigDecimal> allocations) {
		static FundingState start(BigDecimal capital) {
			return new FundingState(capital, Map.of());
		}

		FundingState fund(String goalId, BigDecimal need) {
			BigDecimal amount = need.min(remaining).max(BigDecimal.ZERO);
			Map<String, BigDecimal> next = new LinkedHashMap<>(allocations);
			next.put(goalId, amount);
			return new FundingState(remaining.subtract(amount), Collections.unmodifiableMap(next));
		}
	}
}
