package my.goalplanner.app.service;

import my.goalplanner.app.model.Account;
import my.goalplanner.app.model.AccountAllocation;
import my.goalplanner.app.model.AccountType;
import my.goalplanner.app.model.AssetClassCode;
import my.goalplanner.app.model.GoalPortfolio;
import my.goalplanner.app.model.PlacementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Places the household's target asset amounts into accounts. Tax-deferred accounts take the
 * least tax-efficient assets first, tax-exempt accounts take the highest-growth equity, and
 * taxable accounts absorb the rest. Amounts that do not fit anywhere are reported as unplaced.
 */
@Service
public class AccountPlacementOptimizer {
	private static final Logger logger = LoggerFactory.getLogger(AccountPlacementOptimizer.class);
	private static final int SCALE = 2;

	static final List<AssetClassCode> TAX_DEFERRED_ORDER = sortedByTaxInefficiency();
	static final List<AssetClassCode> TAX_EXEMPT_ORDER = List.of(
			AssetClassCode.EMERGING_MARKETS,
			AssetClassCode.INTERNATIONAL_STOCKS,
			AssetClassCode.US_STOCKS);
	static final List<AssetClassCode> TAXABLE_ORDER = List.of(AssetClassCode.values());

	public PlacementResult place(List<GoalPortfolio> portfolios, List<Account> accounts) {
		if (accounts == null || accounts.isEmpty()) {
			throw new GoalPlanningException("At least one account is required for asset placement",
					GoalPlanningException.ACCOUNTS_EMPTY);
		}
		requireUniqueIds(accounts);
		Map<AssetClassCode, BigDecimal> requested = aggregateTargets(portfolios);
		PlacementState state = PlacementState.start(requested, accounts);
		state = placeInto(state, accounts, AccountType.TAX_DEFERRED, TAX_DEFERRED_ORDER);
		state = placeInto(state, accounts, AccountType.TAX_EXEMPT, TAX_EXEMPT_ORDER);
		state = placeInto(state, accounts, AccountType.TAXABLE, TAXABLE_ORDER);

		Map<AssetClassCode, BigDecimal> unplaced = new EnumMap<>(AssetClassCode.class);
		for (Map.Entry<AssetClassCode, BigDecimal> entry : state.pool().entrySet()) {
			if (entry.getValue().signum() > 0) {
				unplaced.put(entry.getKey(), entry.getValue());
			}
		}
		PlacementResult result = new PlacementResult(state.allocations(),
				Collections.unmodifiableMap(requested),
				Collections.unmodifiableMap(unplaced));
		if (!result.fullyPlaced()) {
			logger.info("Account capacity exhausted; {} left unplaced across {} asset classes.",
					result.totalUnplaced(), unplaced.size());
		}
		return result;
	}

	Map<AssetClassCode, BigDecimal> aggregateTargets(List<GoalPortfolio> portfolios) {
		Map<AssetClassCode, BigDecimal> totals = new EnumMap<>(AssetClassCode.class);
		if (portfolios == null) {
			return totals;
		}
		for (GoalPortfolio portfolio : portfolios) {
			if (portfolio == null || portfolio.getWeights() == null) {
				continue;
			}
			for (AssetClassCode code : portfolio.getWeights().keySet()) {
				totals.merge(code, portfolio.targetAmount(code), BigDecimal::add);
			}
		}
		totals.replaceAll((code, amount) -> amount.setScale(SCALE, RoundingMode.HALF_UP));
		totals.values().removeIf(amount -> amount.signum() <= 0);
		return totals;
	}

	private PlacementState placeInto(PlacementState state, List<Account> accounts, AccountType type,
									 List<AssetClassCode> order) {
		PlacementState next = state;
		for (Account account : accounts) {
			if (account.type() == type) {
				next = next.fill(account, order);
			}
		}
		return next;
	}

	private void requireUniqueIds(List<Account> accounts) {
		Set<String> seen = new HashSet<>();
		for (Account account : accounts) {
			if (!seen.add(account.id())) {
				throw new GoalPlanningException("Duplicate account id: " + account.id(),
						GoalPlanningException.ACCOUNT_DUPLICATE);
			}
		}
	}

	private static List<AssetClassCode> sortedByTaxInefficiency() {
		List<AssetClassCode> codes = new ArrayList<>(Arrays.asList(AssetClassCode.values()));
		codes.sort(Comparator.comparingInt(AssetClassCode::getTaxInefficiencyRank).reversed());
		return List.copyOf(codes);
	}

	/**
	 * Remaining pool per asset class plus the allocations made so far. Each fill returns a new
	 * state; nothing is mutated in place.
	 */
	private record PlacementState(Map<AssetClassCode, BigDecimal> pool,
								  Map<String, AccountAllocation> allocations) {
		static PlacementState start(Map<AssetClassCode, BigDecimal> requested, List<Account> accounts) {
			Map<String, AccountAllocation> allocations = new LinkedHashMap<>();
			for (Account account : accounts) {
				allocations.put(account.id(), new AccountAllocation(account.id(), account.type(),
						account.balance(), Map.of()));
			}
			return new PlacementState(Collections.unmodifiableMap(new EnumMap<>(requested)),
					Collections.unmodifiableMap(allocations));
		}

		PlacementState fill(Account account, List<AssetClassCode> order) {
			AccountAllocation existing = allocations.get(account.id());
			Map<AssetClassCode, BigDecimal> amounts = new EnumMap<>(AssetClassCode.class);
			amounts.putAll(existing.amounts());
			Map<AssetClassCode, BigDecimal> remainingPool = new EnumMap<>(AssetClassCode.class);
			remainingPool.putAll(pool);
			BigDecimal capacity = existing.unusedBalance();

			for (AssetClassCode code : order) {
				if (capacity.signum() <= 0) {
					break;
				}
				BigDecimal available = remainingPool.getOrDefault(code, BigDecimal.ZERO);
				if (available.signum() <= 0) {
					continue;
				}
				BigDecimal amount = available.min(capacity);
				amounts.merge(code, amount, BigDecimal::add);
				remainingPool.put(code, available.subtract(amount));
				capacity = capacity.subtract(amount);
			}

			Map<String, AccountAllocation> nextAllocations = new LinkedHashMap<>(allocations);
			nextAllocations.put(account.id(), new AccountAllocation(account.id(), account.type(),
					account.balance(), Collections.unmodifiableMap(amounts)));
			return new PlacementState(Collections.unmodifiableMap(remainingPool),
					Collections.unmodifiableMap(nextAllocations));
		}
	}
}
