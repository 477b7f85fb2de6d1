package my.goalplanner.app.model;

/**
 * Inputs of one stochastic projection. Rates are annual; {@code yearsToGoal} is truncated to
 * whole months by the engine.
 */
public record GoalProjection(
		double targetAmount,
		double currentAmount,
		double monthlyContribution,
		double yearsToGoal,
		double expectedReturn,
		double volatility
) {
	public int months() {
		if (yearsToGoal <= 0) {
			return 0;
		}
		return (int) (yearsToGoal * 12);
	}

	public GoalProjection withMonthlyContribution(double contribution) {
		return new GoalProjection(targetAmount, currentAmount, contribution, yearsToGoal, expectedReturn, volatility);
	}
}
