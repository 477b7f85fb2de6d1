package my.goalplanner.app.config;

import my.goalplanner.app.cma.CapitalMarketAssumptionsLoader;
import my.goalplanner.app.model.AssetClassAssumption;
import my.goalplanner.app.model.AssetClassCode;
import my.goalplanner.app.model.CapitalMarketAssumptions;
import my.goalplanner.app.service.GoalPlanningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Configuration
public class CapitalMarketAssumptionsConfig {
	private static final Logger logger = LoggerFactory.getLogger(CapitalMarketAssumptionsConfig.class);

	@Bean
	public CapitalMarketAssumptionsLoader capitalMarketAssumptionsLoader() {
		return new CapitalMarketAssumptionsLoader();
	}

	@Bean
	public CapitalMarketAssumptions capitalMarketAssumptions(AppProperties properties,
															 ResourceLoader resourceLoader,
															 CapitalMarketAssumptionsLoader loader) {
		String location = properties.cma().resource();
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new GoalPlanningException("Capital market assumptions resource not found: " + location,
					GoalPlanningException.CMA_INVALID);
		}
		String content;
		try (InputStream inputStream = resource.getInputStream()) {
			content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new GoalPlanningException("Failed to read capital market assumptions from " + location,
					GoalPlanningException.CMA_INVALID, ex);
		}
		CapitalMarketAssumptions assumptions = loader.load(content);
		logger.info("Loaded capital market assumptions '{}' as of {} from {} ({} asset classes).",
				assumptions.getName(), assumptions.getAsOf(), location, assumptions.asMap().size());
		if (logger.isDebugEnabled()) {
			for (AssetClassCode code : AssetClassCode.values()) {
				AssetClassAssumption assumption = assumptions.get(code);
				logger.debug("CMA {}: return={}, volatility={}, taxEfficiency={}", code.getKey(),
						assumption.expectedReturn(), assumption.volatility(), assumption.taxEfficiency());
			}
		}
		return assumptions;
	}
}
