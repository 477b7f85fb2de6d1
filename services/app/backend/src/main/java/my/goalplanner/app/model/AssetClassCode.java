package my.goalplanner.app.model;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * The six sleeves a goal portfolio is split into.
 *
 * <p>{@code taxInefficiencyRank} orders assets for tax-deferred placement: higher ranks
 * generate more taxable income and are placed first.
 */
@Getter
public enum AssetClassCode {
	US_STOCKS("us_stocks", 2),
	INTERNATIONAL_STOCKS("international_stocks", 3),
	EMERGING_MARKETS("emerging_markets", 3),
	BONDS("bonds", 5),
	TIPS("tips", 4),
	CASH("cash", 1);

	private final String key;
	private final int taxInefficiencyRank;

	AssetClassCode(String key, int taxInefficiencyRank) {
		this.key = key;
		this.taxInefficiencyRank = taxInefficiencyRank;
	}

	public static Optional<AssetClassCode> fromKey(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (AssetClassCode code : values()) {
			if (code.key.equals(normalized) || code.name().toLowerCase(Locale.ROOT).equals(normalized)) {
				return Optional.of(code);
			}
		}
		return Optional.empty();
	}
}
