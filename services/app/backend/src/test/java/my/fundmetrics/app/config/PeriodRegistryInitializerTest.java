package my.fundmetrics.app.config;

import my.fundmetrics.app.service.PeriodRegistryService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PeriodRegistryInitializerTest {
	@Test
	void rebuildsEmptyRegistry() {
		PeriodRegistryService service = mock(PeriodRegistryService.class);
		when(service.isEmpty()).thenReturn(true);

		new PeriodRegistryInitializer(service).run(new DefaultApplicationArguments());

		verify(service).rebuildFromStorage();
	}

	@Test
	void leavesPopulatedRegistryAlone() {
		PeriodRegistryService service = mock(PeriodRegistryService.class);
		when(service.isEmpty()).thenReturn(false);

		new PeriodRegistryInitializer(service).run(new DefaultApplicationArguments());

		verify(service, never()).rebuildFromStorage();
	}
}
