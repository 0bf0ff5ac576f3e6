package my.statementfusion.app.config;

import my.statementfusion.app.importer.RetryPolicy;
import my.statementfusion.app.importer.TextSourceReader;
import my.statementfusion.app.service.ExtractionSettings;
import my.statementfusion.app.service.StatementExtractionService;
import my.statementfusion.app.strategy.StrategyRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExtractionConfig {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

	private static final int DEFAULT_STRATEGY_THREADS = 4;
	private static final int DEFAULT_SOURCE_THREADS = 2;

	@Bean
	public ExtractionSettings extractionSettings(AppProperties properties) {
		ExtractionSettings settings = ExtractionSettings.from(properties.extraction());
		logger.info("Extraction configured (band={}..{}, fixedOffset={}, priority={}).",
				settings.band().min().toPlainString(), settings.band().max().toPlainString(),
				settings.fixedOffset(), settings.fusionPolicy().priority());
		return settings;
	}

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService strategyExecutor(AppProperties properties) {
		AppProperties.Runner runner = properties.runner();
		int threads = runner == null || runner.strategyThreads() == null
				? DEFAULT_STRATEGY_THREADS
				: runner.strategyThreads();
		CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("strategy-");
		threadFactory.setDaemon(true);
		return Executors.newFixedThreadPool(threads, threadFactory);
	}

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService sourceExecutor(AppProperties properties) {
		AppProperties.Sources sources = properties.sources();
		int threads = sources == null || sources.threads() == null ? DEFAULT_SOURCE_THREADS : sources.threads();
		CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("text-source-");
		threadFactory.setDaemon(true);
		return Executors.newFixedThreadPool(threads, threadFactory);
	}

	@Bean
	public StrategyRunner strategyRunner(AppProperties properties,
										 @Qualifier("strategyExecutor") ExecutorService strategyExecutor) {
		Duration timeout = properties.runner() == null ? null : properties.runner().strategyTimeout();
		return new StrategyRunner(strategyExecutor, timeout);
	}

	@Bean
	public TextSourceReader textSourceReader(AppProperties properties,
											 @Qualifier("sourceExecutor") ExecutorService sourceExecutor) {
		AppProperties.Sources sources = properties.sources();
		RetryPolicy retryPolicy = sources == null
				? RetryPolicy.DEFAULT
				: new RetryPolicy(
						sources.maxAttempts() == null ? RetryPolicy.DEFAULT_MAX_ATTEMPTS : sources.maxAttempts(),
						sources.initialBackoff(),
						sources.maxBackoff(),
						sources.attemptTimeout());
		return new TextSourceReader(sourceExecutor, retryPolicy);
	}

	@Bean
	public StatementExtractionService statementExtractionService(ExtractionSettings settings,
																 StrategyRunner strategyRunner,
																 TextSourceReader textSourceReader) {
		return new StatementExtractionService(settings, strategyRunner, textSourceReader);
	}
}
