package my.goalplanner.app.cma;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapitalMarketAssumptionsParserTest {
	private final CapitalMarketAssumptionsParser parser = new CapitalMarketAssumptionsParser();

	@Test
	void parsesSnakeCaseJson() throws Exception {
		String json = """
				{
				  "schema_version": 1,
				  "name": "baseline",
				  "ignored_field": true,
				  "asset_classes": [
				    {"code": "bonds", "name": "Bonds", "expected_return": 0.04, "volatility": 0.06, "tax_efficiency": 0.6}
				  ]
				}
				""";

		CapitalMarketAssumptionsDefinition definition = parser.parse(json);

		assertThat(definition.getSchemaVersion()).isEqualTo(1);
		assertThat(definition.getName()).isEqualTo("baseline");
		assertThat(definition.getAssetClasses()).hasSize(1);
		AssetClassDefinition bonds = definition.getAssetClasses().get(0);
		assertThat(bonds.getCode()).isEqualTo("bonds");
		assertThat(bonds.getExpectedReturn()).isEqualTo(0.04);
		assertThat(bonds.getTaxEfficiency()).isEqualTo(0.6);
	}

	@Test
	void fallsBackToYaml() throws Exception {
		String yaml = """
				schema_version: 1
				name: yaml-table
				asset_classes:
				  - code: cash
				    expected_return: 0.02
				    volatility: 0.01
				    tax_efficiency: 0.7
				""";

		CapitalMarketAssumptionsDefinition definition = parser.parse(yaml);

		assertThat(definition.getName()).isEqualTo("yaml-table");
		assertThat(definition.getAssetClasses().get(0).getVolatility()).isEqualTo(0.01);
	}

	@Test
	void failsOnGarbage() {
		assertThatThrownBy(() -> parser.parse("{ not: [valid")).isInstanceOf(Exception.class);
	}
}
