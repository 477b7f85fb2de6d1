package my.goalplanner.app.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A household account. {@code currentHoldings} is optional and only feeds the drift check.
 */
public record Account(
		@NotBlank String id,
		String name,
		@NotNull AccountType type,
		@NotNull @PositiveOrZero BigDecimal balance,
		Map<AssetClassCode, BigDecimal> currentHoldings
) {
	public Account(String id, String name, AccountType type, BigDecimal balance) {
		this(id, name, type, balance, Map.of());
	}

	public Map<AssetClassCode, BigDecimal> holdings() {
		return currentHoldings == null ? Map.of() : currentHoldings;
	}
}
