package my.goalplanner.app.model;

import java.math.BigDecimal;
import java.util.Map;

public record AccountAllocation(
		String accountId,
		AccountType accountType,
		BigDecimal balance,
		Map<AssetClassCode, BigDecimal> amounts
) {
	public BigDecimal placedTotal() {
		return amounts.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
	}

	public BigDecimal unusedBalance() {
		return balance.subtract(placedTotal());
	}
}
