package my.goalplanner.app.model;

import lombok.Getter;

/**
 * Goal priority. Lower rank is funded first when capital is scarce.
 */
@Getter
public enum GoalPriority {
	ESSENTIAL(1, -0.1),
	IMPORTANT(2, 0.0),
	ASPIRATIONAL(3, 0.1);

	private final int rank;
	private final double defaultRiskAdjustment;

	GoalPriority(int rank, double defaultRiskAdjustment) {
		this.rank = rank;
		this.defaultRiskAdjustment = defaultRiskAdjustment;
	}
}
