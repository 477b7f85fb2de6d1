package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.model.AssetClassCode;
import my.goalplanner.app.model.CapitalMarketAssumptions;
import my.goalplanner.app.model.Goal;
import my.goalplanner.app.model.GoalPortfolio;
import my.goalplanner.app.model.GoalPriority;
import org.apache.commons.math3.util.FastMath;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a goal's horizon and priority to a six-sleeve asset mix. Longer horizons and looser
 * priorities hold more equity; the equity and fixed-income sleeves are split by configured ratios.
 */
@Service
public class GlidePathAllocator {
	private static final double MIN_EQUITY = 0.1;
	private static final double MAX_EQUITY = 0.9;
	private static final double HORIZON_YEARS = 50.0;

	private final AppProperties.GlidePath settings;

	public GlidePathAllocator(AppProperties properties) {
		this.settings = properties.glidePath();
	}

	public GoalPortfolio buildPortfolio(Goal goal, BigDecimal allocatedAmount, CapitalMarketAssumptions assumptions) {
		double years = goal.yearsToGoal();
		double riskTolerance = riskTolerance(years, goal.priority());
		Map<AssetClassCode, Double> weights = weights(years, riskTolerance);

		double expectedReturn = 0.0;
		double expectedRisk = 0.0;
		for (Map.Entry<AssetClassCode, Double> entry : weights.entrySet()) {
			expectedReturn += entry.getValue() * assumptions.expectedReturn(entry.getKey());
			expectedRisk += entry.getValue() * assumptions.volatility(entry.getKey());
		}
		double sharpe = expectedRisk > 0 ? (expectedReturn - settings.riskFreeRate()) / expectedRisk : 0.0;

		return new GoalPortfolio(goal.id(), goal.name(),
				allocatedAmount == null ? BigDecimal.ZERO : allocatedAmount,
				years, riskTolerance, weights, expectedReturn, expectedRisk, sharpe);
	}

	public double riskTolerance(double years, GoalPriority priority) {
		double base;
		if (years >= 30) {
			base = 0.9;
		} else if (years >= 20) {
			base = 0.8;
		} else if (years >= 15) {
			base = 0.7;
		} else if (years >= 10) {
			base = 0.6;
		} else if (years >= 5) {
			base = 0.4;
		} else if (years >= 3) {
			base = 0.3;
		} else {
			base = 0.2;
		}
		return clamp(base + settings.priorityAdjustment(priority), 0.0, 1.0);
	}

	public double equityShare(double years, double riskTolerance) {
		double base = clamp(1.0 - years / HORIZON_YEARS, MIN_EQUITY, MAX_EQUITY);
		return clamp(base * (0.7 + riskTolerance * 0.6), MIN_EQUITY, MAX_EQUITY);
	}

	public Map<AssetClassCode, Double> weights(double years, double riskTolerance) {
		double equity = equityShare(years, riskTolerance);
		double fixedIncome = 1.0 - equity;

		AppProperties.GlidePath.EquitySplit equitySplit = settings.equitySplit();
		double equityTotal = equitySplit.domestic() + equitySplit.international() + equitySplit.emerging();
		AppProperties.GlidePath.FixedIncomeSplit incomeSplit = settings.fixedIncomeSplit();
		double incomeTotal = incomeSplit.bonds() + incomeSplit.inflationProtected() + incomeSplit.cash();

		Map<AssetClassCode, Double> weights = new EnumMap<>(AssetClassCode.class);
		weights.put(AssetClassCode.US_STOCKS, share(equity, equitySplit.domestic(), equityTotal));
		weights.put(AssetClassCode.INTERNATIONAL_STOCKS, share(equity, equitySplit.international(), equityTotal));
		weights.put(AssetClassCode.EMERGING_MARKETS, share(equity, equitySplit.emerging(), equityTotal));
		weights.put(AssetClassCode.BONDS, share(fixedIncome, incomeSplit.bonds(), incomeTotal));
		weights.put(AssetClassCode.TIPS, share(fixedIncome, incomeSplit.inflationProtected(), incomeTotal));
		weights.put(AssetClassCode.CASH, share(fixedIncome, incomeSplit.cash(), incomeTotal));
		return Collections.unmodifiableMap(weights);
	}

	// an all-zero split falls back to equal thirds
	private double share(double sleeve, double part, double total) {
		if (total <= 0) {
			return sleeve / 3.0;
		}
		return sleeve * part / total;
	}

	private double clamp(double value, double min, double max) {
		return FastMath.max(min, FastMath.min(max, value));
	}
}
