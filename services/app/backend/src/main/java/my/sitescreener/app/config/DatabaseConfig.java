package my.sitescreener.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import javax.sql.DataSource;

/**
 * Waits for PostgreSQL, then applies the Liquibase changelog before the JPA entity manager
 * factory is created.
 */
@Configuration
@EnableConfigurationProperties(DatabaseConfig.SchemaSettings.class)
public class DatabaseConfig {
	private static final String DEFAULT_CHANGELOG = "classpath:db/changelog/db.changelog-master.yaml";

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, SchemaSettings settings) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(settings.getStartupTimeoutSeconds());
		validator.setInterval(5);
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, SchemaSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		String changeLog = settings.getChangeLog();
		liquibase.setChangeLog(changeLog == null || changeLog.isBlank() ? DEFAULT_CHANGELOG : changeLog);
		liquibase.setShouldRun(settings.isEnabled());
		return liquibase;
	}

	@Bean
	public static BeanFactoryPostProcessor liquibaseDependsOnPostProcessor() {
		return beanFactory -> {
			ensureDependsOn(beanFactory, "entityManagerFactory", "liquibase");
			ensureDependsOn(beanFactory, "jpaSharedEM_entityManagerFactory", "liquibase");
		};
	}

	private static void ensureDependsOn(ConfigurableListableBeanFactory beanFactory, String beanName, String dependency) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		Set<String> merged = new LinkedHashSet<>();
		String[] existing = definition.getDependsOn();
		if (existing != null) {
			merged.addAll(Arrays.asList(existing));
		}
		merged.add(dependency);
		definition.setDependsOn(merged.toArray(new String[0]));
	}

	@ConfigurationProperties(prefix = "spring.liquibase")
	public static class SchemaSettings {
		private String changeLog;
		private boolean enabled = true;
		private int startupTimeoutSeconds = 60;

		public String getChangeLog() {
			return changeLog;
		}

		public void setChangeLog(String changeLog) {
			this.changeLog = changeLog;
		}

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public int getStartupTimeoutSeconds() {
			return startupTimeoutSeconds;
		}

		public void setStartupTimeoutSeconds(int startupTimeoutSeconds) {
			this.startupTimeoutSeconds = startupTimeoutSeconds;
		}
	}
}
