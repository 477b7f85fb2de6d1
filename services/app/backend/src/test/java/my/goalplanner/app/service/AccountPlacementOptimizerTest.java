package my.goalplanner.app.service;

import my.goalplanner.app.model.Account;
import my.goalplanner.app.model.AccountAllocation;
import my.goalplanner.app.model.AccountType;
import my.goalplanner.app.model.AssetClassCode;
import my.goalplanner.app.model.GoalPortfolio;
import my.goalplanner.app.model.PlacementResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountPlacementOptimizerTest {
	private final AccountPlacementOptimizer optimizer = new AccountPlacementOptimizer();

	@Test
	void taxDeferredOrderPutsLeastEfficientAssetsFirst() {
		assertThat(AccountPlacementOptimizer.TAX_DEFERRED_ORDER).containsExactly(
				AssetClassCode.BONDS,
				AssetClassCode.TIPS,
				AssetClassCode.INTERNATIONAL_STOCKS,
				AssetClassCode.EMERGING_MARKETS,
				AssetClassCode.US_STOCKS,
				AssetClassCode.CASH);
	}

	@Test
	void bondsLandInTaxDeferredAccountBeforeStocks() {
		GoalPortfolio portfolio = portfolio("retire", "100000",
				Map.of(AssetClassCode.US_STOCKS, 0.5, AssetClassCode.BONDS, 0.3, AssetClassCode.CASH, 0.2));
		Account ira = new Account("ira", "IRA", AccountType.TAX_DEFERRED, new BigDecimal("40000"));
		Account brokerage = new Account("brokerage", "Brokerage", AccountType.TAXABLE, new BigDecimal("100000"));

		PlacementResult result = optimizer.place(List.of(portfolio), List.of(brokerage, ira));

		Map<AssetClassCode, BigDecimal> iraAmounts = result.accountAllocations().get("ira").amounts();
		assertThat(iraAmounts.get(AssetClassCode.BONDS)).isEqualByComparingTo("30000");
		assertThat(iraAmounts.get(AssetClassCode.US_STOCKS)).isEqualByComparingTo("10000");
		assertThat(iraAmounts).doesNotContainKey(AssetClassCode.CASH);

		Map<AssetClassCode, BigDecimal> taxableAmounts = result.accountAllocations().get("brokerage").amounts();
		assertThat(taxableAmounts.get(AssetClassCode.US_STOCKS)).isEqualByComparingTo("40000");
		assertThat(taxableAmounts.get(AssetClassCode.CASH)).isEqualByComparingTo("20000");
		assertThat(result.fullyPlaced()).isTrue();
		assertThat(result.accountAllocations().keySet()).containsExactly("brokerage", "ira");
	}

	@Test
	void taxExemptAccountPrefersHighGrowthEquity() {
		GoalPortfolio portfolio = portfolio("retire", "100000", Map.of(
				AssetClassCode.US_STOCKS, 0.4,
				AssetClassCode.INTERNATIONAL_STOCKS, 0.3,
				AssetClassCode.EMERGING_MARKETS, 0.3));
		Account roth = new Account("roth", "Roth", AccountType.TAX_EXEMPT, new BigDecimal("50000"));
		Account brokerage = new Account("brokerage", "Brokerage", AccountType.TAXABLE, new BigDecimal("50000"));

		PlacementResult result = optimizer.place(List.of(portfolio), List.of(roth, brokerage));

		Map<AssetClassCode, BigDecimal> rothAmounts = result.accountAllocations().get("roth").amounts();
		assertThat(rothAmounts.get(AssetClassCode.EMERGING_MARKETS)).isEqualByComparingTo("30000");
		assertThat(rothAmounts.get(AssetClassCode.INTERNATIONAL_STOCKS)).isEqualByComparingTo("20000");
		assertThat(rothAmounts).doesNotContainKey(AssetClassCode.US_STOCKS);
		assertThat(result.accountAllocations().get("brokerage").amounts().get(AssetClassCode.INTERNATIONAL_STOCKS))
				.isEqualByComparingTo("10000");
	}

	@Test
	void reportsWhatAccountsCannotHold() {
		GoalPortfolio first = portfolio("a", "60000", Map.of(AssetClassCode.US_STOCKS, 0.5, AssetClassCode.BONDS, 0.5));
		GoalPortfolio second = portfolio("b", "40000", Map.of(AssetClassCode.US_STOCKS, 1.0));
		Account ira = new Account("ira", "IRA", AccountType.TAX_DEFERRED, new BigDecimal("20000"));
		Account brokerage = new Account("brokerage", "Brokerage", AccountType.TAXABLE, new BigDecimal("40000"));

		PlacementResult result = optimizer.place(List.of(first, second), List.of(ira, brokerage));

		assertThat(result.requested().get(AssetClassCode.US_STOCKS)).isEqualByComparingTo("70000");
		assertThat(result.requested().get(AssetClassCode.BONDS)).isEqualByComparingTo("30000");
		assertThat(result.fullyPlaced()).isFalse();
		assertThat(result.totalUnplaced()).isEqualByComparingTo("40000");

		for (AssetClassCode code : result.requested().keySet()) {
			BigDecimal placed = result.accountAllocations().values().stream()
					.map(allocation -> allocation.amounts().getOrDefault(code, BigDecimal.ZERO))
					.reduce(BigDecimal.ZERO, BigDecimal::add);
			BigDecimal unplaced = result.unplaced().getOrDefault(code, BigDecimal.ZERO);
			assertThat(placed.add(unplaced)).isEqualByComparingTo(result.requested().get(code));
		}
		for (AccountAllocation allocation : result.accountAllocations().values()) {
			assertThat(allocation.placedTotal()).isLessThanOrEqualTo(allocation.balance());
			assertThat(allocation.unusedBalance().signum()).isGreaterThanOrEqualTo(0);
		}
	}

	@Test
	void leavesSpareCapacityUnused() {
		GoalPortfolio portfolio = portfolio("small", "1000", Map.of(AssetClassCode.CASH, 1.0));
		Account brokerage = new Account("brokerage", "Brokerage", AccountType.TAXABLE, new BigDecimal("5000"));

		PlacementResult result = optimizer.place(List.of(portfolio), List.of(brokerage));

		assertThat(result.accountAllocations().get("brokerage").unusedBalance()).isEqualByComparingTo("4000");
		assertThat(result.unplaced()).isEmpty();
	}

	@Test
	void rejectsMissingAccounts() {
		GoalPortfolio portfolio = portfolio("a", "1000", Map.of(AssetClassCode.CASH, 1.0));

		assertThatThrownBy(() -> optimizer.place(List.of(portfolio), List.of()))
				.isInstanceOfSatisfying(GoalPlanningException.class,
						ex -> assertThat(ex.getErrorCode()).isEqualTo(GoalPlanningException.ACCOUNTS_EMPTY));
	}

	@Test
	void rejectsAccountsSharingAnId() {
		GoalPortfolio portfolio = portfolio("a", "100000", Map.of(AssetClassCode.BONDS, 1.0));
		Account ira = new Account("acct", "IRA", AccountType.TAX_DEFERRED, new BigDecimal("60000"));
		Account brokerage = new Account("acct", "Brokerage", AccountType.TAXABLE, new BigDecimal("40000"));

		assertThatThrownBy(() -> optimizer.place(List.of(portfolio), List.of(ira, brokerage)))
				.isInstanceOfSatisfying(GoalPlanningException.class,
						ex -> assertThat(ex.getErrorCode()).isEqualTo(GoalPlanningException.ACCOUNT_DUPLICATE));
	}

	private GoalPortfolio portfolio(String goalId, String amount, Map<AssetClassCode, Double> weights) {
		return new GoalPortfolio(goalId, goalId, new BigDecimal(amount), 10, 0.5,
				new EnumMap<>(weights), 0.07, 0.12, 0.25);
	}
}
