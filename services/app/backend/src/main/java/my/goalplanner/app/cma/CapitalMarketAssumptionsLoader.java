package my.goalplanner.app.cma;

import my.goalplanner.app.model.AssetClassAssumption;
import my.goalplanner.app.model.AssetClassCode;
import my.goalplanner.app.model.CapitalMarketAssumptions;
import my.goalplanner.app.service.GoalPlanningException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parses, validates and converts a CMA document into the immutable table used by the engines.
 */
public class CapitalMarketAssumptionsLoader {
	private final CapitalMarketAssumptionsParser parser;
	private final CapitalMarketAssumptionsValidator validator;

	public CapitalMarketAssumptionsLoader() {
		this(new CapitalMarketAssumptionsParser(), new CapitalMarketAssumptionsValidator());
	}

	public CapitalMarketAssumptionsLoader(CapitalMarketAssumptionsParser parser,
										  CapitalMarketAssumptionsValidator validator) {
		this.parser = parser;
		this.validator = validator;
	}

	public CapitalMarketAssumptions load(String content) {
		if (content == null || content.isBlank()) {
			throw new GoalPlanningException("Capital market assumptions document is empty",
					GoalPlanningException.CMA_INVALID);
		}
		CapitalMarketAssumptionsDefinition definition;
		try {
			definition = parser.parse(content);
		} catch (Exception ex) {
			throw new GoalPlanningException("Capital market assumptions could not be parsed: " + ex.getMessage(),
					GoalPlanningException.CMA_INVALID, ex);
		}
		List<String> errors = validator.validate(definition);
		if (!errors.isEmpty()) {
			throw new GoalPlanningException("Capital market assumptions invalid: " + String.join("; ", errors),
					GoalPlanningException.CMA_INVALID);
		}
		Map<AssetClassCode, AssetClassAssumption> assumptions = new EnumMap<>(AssetClassCode.class);
		for (AssetClassDefinition assetClass : definition.getAssetClasses()) {
			AssetClassCode code = AssetClassCode.fromKey(assetClass.getCode()).orElseThrow();
			String name = assetClass.getName() == null || assetClass.getName().isBlank()
					? code.getKey()
					: assetClass.getName();
			assumptions.put(code, new AssetClassAssumption(name,
					assetClass.getExpectedReturn(),
					assetClass.getVolatility(),
					assetClass.getTaxEfficiency()));
		}
		return new CapitalMarketAssumptions(definition.getName(), definition.getAsOf(), assumptions);
	}
}
