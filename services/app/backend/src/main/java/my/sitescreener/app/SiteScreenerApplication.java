package my.sitescreener.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SiteScreenerApplication {
	public static void main(String[] args) {
		SpringApplication.run(SiteScreenerApplication.class, args);
	}
}
