package my.goalplanner.app.cma;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

public class CapitalMarketAssumptionsParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public CapitalMarketAssumptionsParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public CapitalMarketAssumptionsDefinition parse(String content) throws Exception {
		try {
			return jsonMapper.readValue(content, CapitalMarketAssumptionsDefinition.class);
		} catch (Exception jsonEx) {
			return yamlMapper.readValue(content, CapitalMarketAssumptionsDefinition.class);
		}
	}
}
