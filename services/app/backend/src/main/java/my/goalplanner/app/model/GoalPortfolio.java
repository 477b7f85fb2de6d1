package my.goalplanner.app.model;

import java.math.BigDecimal;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class GoalPortfolio {
	private final String goalId;
	private final String goalName;
	private final BigDecimal allocatedAmount;
	private final double yearsToGoal;
	private final double riskTolerance;
	private final Map<AssetClassCode, Double> weights;
	private final double expectedReturn;
	private final double expectedRisk;
	private final double sharpeRatio;

	public BigDecimal targetAmount(AssetClassCode code) {
		Double weight = weights.get(code);
		if (weight == null || allocatedAmount == null) {
			return BigDecimal.ZERO;
		}
		return allocatedAmount.multiply(BigDecimal.valueOf(weight));
	}
}
