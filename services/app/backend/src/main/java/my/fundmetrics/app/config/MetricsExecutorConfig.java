package my.fundmetrics.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class MetricsExecutorConfig {
	/**
	 * Workers for per-stock metric computation inside one fund run.
	 */
	@Bean(name = "metricsWorkerPool", destroyMethod = "shutdownNow")
	public ExecutorService metricsWorkerPool(AppProperties properties) {
		int threads = Math.max(1, properties.metrics().parallelism());
		AtomicInteger counter = new AtomicInteger();
		ThreadFactory factory = runnable -> {
			Thread thread = new Thread(runnable, "metrics-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
		return Executors.newFixedThreadPool(threads, factory);
	}
}
