package my.fundmetrics.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.fundmetrics.app.importer.HeaderLayout;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Sheet sheet,
		@Valid @NotNull Metrics metrics
) {
	public record Sheet(
			@Min(1) int headerRows,
			@PositiveOrZero int titleRow,
			@PositiveOrZero int categoryRow,
			@PositiveOrZero int subcategoryRow,
			@PositiveOrZero int periodRow,
			@Min(1) int identityScanColumns
	) {
		public HeaderLayout toHeaderLayout() {
			return new HeaderLayout(headerRows, titleRow, categoryRow, subcategoryRow, periodRow, identityScanColumns);
		}
	}

	public record Metrics(
			double bondRate,
			@PositiveOrZero int periodLimit,
			@Min(1) int parallelism,
			@Min(1) int maxConcurrentJobs,
			@Min(1) int jobTtlMinutes
	) {
	}
}
