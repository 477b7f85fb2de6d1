package my.goalplanner.app.model;

public record SimulationResult(
		double successProbability,
		double medianOutcome,
		double percentile10,
		double percentile25,
		double percentile75,
		double percentile90,
		double expectedValue,
		double standardDeviation,
		double shortfallRisk,
		double medianShortfall,
		double targetAmount,
		int iterations
) {
}
