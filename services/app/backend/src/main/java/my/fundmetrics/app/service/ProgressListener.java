package my.fundmetrics.app.service;

@FunctionalInterface
public interface ProgressListener {
	ProgressListener NONE = update -> {
	};

	void onProgress(ProgressUpdate update);
}
