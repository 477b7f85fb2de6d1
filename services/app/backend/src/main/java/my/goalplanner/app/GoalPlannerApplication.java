package my.goalplanner.app;

import my.goalplanner.app.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class GoalPlannerApplication {
	public static void main(String[] args) {
		SpringApplication.run(GoalPlannerApplication.class, args);
	}
}
