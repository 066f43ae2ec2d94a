package my.fundmetrics.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(DatabaseConfig.LiquibaseSettings.class)
public class DatabaseConfig {
	static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";

	@Bean
	public SpringLiquibase liquibase(DataSource dataSource, LiquibaseSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		String changeLog = settings.getChangeLog();
		liquibase.setChangeLog(changeLog == null || changeLog.isBlank() ? DEFAULT_CHANGE_LOG : changeLog);
		liquibase.setShouldRun(settings.isEnabled());
		return liquibase;
	}

	/**
	 * The entity manager starts only after the migrations ran.
	 */
	@Bean
	public static BeanFactoryPostProcessor liquibaseDependsOnPostProcessor() {
		return beanFactory -> ensureDependsOn(beanFactory, "entityManagerFactory", "liquibase");
	}

	private static void ensureDependsOn(ConfigurableListableBeanFactory beanFactory, String beanName,
										String dependency) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		Set<String> merged = new LinkedHashSet<>();
		if (definition.getDependsOn() != null) {
			merged.addAll(Arrays.asList(definition.getDependsOn()));
		}
		merged.add(dependency);
		definition.setDependsOn(merged.toArray(new String[0]));
	}

	@ConfigurationProperties(prefix = "spring.liquibase")
	public static class LiquibaseSettings {
		private String changeLog;
		private boolean enabled = true;

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
	}
}
