package my.goalplanner.app.cma;

import my.goalplanner.app.model.AssetClassCode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public class CapitalMarketAssumptionsValidator {
	public List<String> validate(CapitalMarketAssumptionsDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null) {
			errors.add("Capital market assumptions are empty");
			return errors;
		}
		if (definition.getSchemaVersion() != 1) {
			errors.add("schema_version must be 1");
		}
		if (definition.getAssetClasses() == null || definition.getAssetClasses().isEmpty()) {
			errors.add("asset_classes must be provided");
			return errors;
		}
		Set<AssetClassCode> seen = EnumSet.noneOf(AssetClassCode.class);
		for (AssetClassDefinition assetClass : definition.getAssetClasses()) {
			if (assetClass == null) {
				errors.add("asset_classes must not contain null entries");
				continue;
			}
			AssetClassCode code = AssetClassCode.fromKey(assetClass.getCode()).orElse(null);
			if (code == null) {
				errors.add("asset_class.code is unknown: " + assetClass.getCode());
				continue;
			}
			if (!seen.add(code)) {
				errors.add("asset_class.code is duplicated: " + code.getKey());
			}
			String label = "asset_class " + code.getKey();
			Double expectedReturn = assetClass.getExpectedReturn();
			if (expectedReturn == null || expectedReturn <= 0.0 || expectedReturn >= 1.0) {
				errors.add(label + ": expected_return must be between 0 and 1 (exclusive)");
			}
			Double volatility = assetClass.getVolatility();
			if (volatility == null || volatility <= 0.0 || volatility >= 1.0) {
				errors.add(label + ": volatility must be between 0 and 1 (exclusive)");
			}
			Double taxEfficiency = assetClass.getTaxEfficiency();
			if (taxEfficiency == null || taxEfficiency < 0.0 || taxEfficiency > 1.0) {
				errors.add(label + ": tax_efficiency must be between 0 and 1");
			}
		}
		for (AssetClassCode code : AssetClassCode.values()) {
			if (!seen.contains(code)) {
				errors.add("asset_classes is missing " + code.getKey());
			}
		}
		return errors;
	}
}
