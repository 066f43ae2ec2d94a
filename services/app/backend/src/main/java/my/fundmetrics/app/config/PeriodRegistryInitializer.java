package my.fundmetrics.app.config;

import my.fundmetrics.app.service.PeriodRegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Fills an empty period registry from the periods already stored, e.g. right after a migration.
 */
@Component
public class PeriodRegistryInitializer implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(PeriodRegistryInitializer.class);

	private final PeriodRegistryService periodRegistryService;

	public PeriodRegistryInitializer(PeriodRegistryService periodRegistryService) {
		this.periodRegistryService = periodRegistryService;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!periodRegistryService.isEmpty()) {
			return;
		}
		logger.info("Period registry is empty; rebuilding from stored time series");
		periodRegistryService.rebuildFromStorage();
	}
}
