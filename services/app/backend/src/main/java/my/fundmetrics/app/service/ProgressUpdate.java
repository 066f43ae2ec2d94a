package my.fundmetrics.app.service;

/**
 * Progress of a calculation run. {@link Level#ENTITY} updates count stocks inside {@code fundName};
 * {@link Level#FUND} updates count funds in a batch.
 */
public record ProgressUpdate(Level level,
							 String fundName,
							 int processedCount,
							 int totalCount,
							 String currentEntityName,
							 String status) {
	public static final String STATUS_RUNNING = "RUNNING";
	public static final String STATUS_COMPLETED = "COMPLETED";
	public static final String STATUS_FAILED = "FAILED";
	public static final String STATUS_CANCELLED = "CANCELLED";

	public double percentage() {
		return totalCount <= 0 ? 100.0 : processedCount * 100.0 / totalCount;
	}

	public enum Level {
		ENTITY,
		FUND
	}
}
