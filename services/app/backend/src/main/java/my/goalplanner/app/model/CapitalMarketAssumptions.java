package my.goalplanner.app.model;

import my.goalplanner.app.service.GoalPlanningException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable CMA table covering every {@link AssetClassCode}. Passed explicitly into each
 * calculation so alternative assumption sets can be swapped in per call.
 */
public final class CapitalMarketAssumptions {
	private final String name;
	private final String asOf;
	private final Map<AssetClassCode, AssetClassAssumption> assumptions;

	public CapitalMarketAssumptions(Map<AssetClassCode, AssetClassAssumption> assumptions) {
		this(null, null, assumptions);
	}

	public CapitalMarketAssumptions(String name, String asOf, Map<AssetClassCode, AssetClassAssumption> assumptions) {
		if (assumptions == null) {
			throw new GoalPlanningException("Capital market assumptions are missing", GoalPlanningException.CMA_INVALID);
		}
		EnumMap<AssetClassCode, AssetClassAssumption> copy = new EnumMap<>(AssetClassCode.class);
		copy.putAll(assumptions);
		for (AssetClassCode code : AssetClassCode.values()) {
			if (!copy.containsKey(code) || copy.get(code) == null) {
				throw new GoalPlanningException("No capital market assumption for " + code.getKey(),
						GoalPlanningException.CMA_INVALID);
			}
		}
		this.name = name;
		this.asOf = asOf;
		this.assumptions = Collections.unmodifiableMap(copy);
	}

	public String getName() {
		return name;
	}

	public String getAsOf() {
		return asOf;
	}

	public AssetClassAssumption get(AssetClassCode code) {
		return assumptions.get(code);
	}

	public double expectedReturn(AssetClassCode code) {
		return assumptions.get(code).expectedReturn();
	}

	public double volatility(AssetClassCode code) {
		return assumptions.get(code).volatility();
	}

	public double taxEfficiency(AssetClassCode code) {
		return assumptions.get(code).taxEfficiency();
	}

	public Map<AssetClassCode, AssetClassAssumption> asMap() {
		return assumptions;
	}
}
