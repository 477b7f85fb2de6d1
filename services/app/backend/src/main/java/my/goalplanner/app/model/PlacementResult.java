package my.goalplanner.app.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Target-state placement of the household's asset amounts. {@code unplaced} holds whatever the
 * accounts could not absorb.
 */
public record PlacementResult(
		Map<String, AccountAllocation> accountAllocations,
		Map<AssetClassCode, BigDecimal> requested,
		Map<AssetClassCode, BigDecimal> unplaced
) {
	public BigDecimal totalUnplaced() {
		return unplaced.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
	}

	public boolean fullyPlaced() {
		return totalUnplaced().signum() == 0;
	}
}
