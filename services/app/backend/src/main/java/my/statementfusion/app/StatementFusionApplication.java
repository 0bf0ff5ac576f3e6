package my.statementfusion.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StatementFusionApplication {
	public static void main(String[] args) {
		SpringApplication.run(StatementFusionApplication.class, args);
	}
}
