package my.goalplanner.app.model;

import java.math.BigDecimal;
import java.util.Map;

public record HouseholdStats(
		BigDecimal totalValue,
		double weightedReturn,
		double weightedRisk,
		double sharpeRatio,
		Map<AssetClassCode, Double> aggregateAllocation,
		double diversificationScore
) {
	public static HouseholdStats empty() {
		return new HouseholdStats(BigDecimal.ZERO, 0.0, 0.0, 0.0, Map.of(), 0.0);
	}
}
