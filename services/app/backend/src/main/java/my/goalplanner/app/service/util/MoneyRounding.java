package my.goalplanner.app.service.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyRounding {
	public static final int MONEY_SCALE = 2;
	public static final int RATE_SCALE = 4;

	private MoneyRounding() {
	}

	public static BigDecimal money(double value) {
		if (!Double.isFinite(value)) {
			return BigDecimal.ZERO.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
		}
		return BigDecimal.valueOf(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal money(BigDecimal value) {
		if (value == null) {
			return BigDecimal.ZERO.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
		}
		return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
	}

	public static double rate(double value) {
		return round(value, RATE_SCALE);
	}

	/**
	 * Rounds half-up. Infinite and NaN values are returned unchanged.
	 */
	public static double round(double value, int scale) {
		if (!Double.isFinite(value)) {
			return value;
		}
		return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
	}
}
