package my.fundmetrics.app.importer;

/**
 * A stock sheet header is missing something every later step depends on. Raised before anything is written.
 */
public class SchemaException extends RuntimeException {
	private final String missingColumn;

	public SchemaException(String missingColumn, String message) {
		super(message);
		this.missingColumn = missingColumn;
	}

	public String getMissingColumn() {
		return missingColumn;
	}
}
