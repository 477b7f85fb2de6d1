package my.goalplanner.app.model;

/**
 * Annualized capital market assumption for one asset class.
 *
 * @param expectedReturn annual expected return
 * @param volatility     annual standard deviation of returns
 * @param taxEfficiency  0 (fully taxed income) to 1 (tax-exempt growth)
 */
public record AssetClassAssumption(
		String name,
		double expectedReturn,
		double volatility,
		double taxEfficiency
) {
}
