package my.statementfusion.app.importer;

import my.statementfusion.app.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads several text sources concurrently. Each attempt is bounded by a timeout that starts when
 * the read starts running; a timed-out read is cancelled and its worker interrupted, so it does
 * not hold a pool thread while sibling sources wait. Retryable failures and timeouts are retried
 * with exponential backoff. A source that still fails is logged and left out of the result.
 */
public class TextSourceReader {
	private static final Logger logger = LoggerFactory.getLogger(TextSourceReader.class);

	private final ExecutorService executor;
	private final RetryPolicy retryPolicy;

	public TextSourceReader(ExecutorService executor, RetryPolicy retryPolicy) {
		if (executor == null) {
			throw new IllegalArgumentException("Source executor is required");
		}
		this.executor = executor;
		this.retryPolicy = retryPolicy == null ? RetryPolicy.DEFAULT : retryPolicy;
	}

	public RetryPolicy retryPolicy() {
		return retryPolicy;
	}

	/**
	 * @return the documents that could be read, keyed by source name in the order the sources were given
	 */
	public Map<String, Document> readAll(List<? extends TextSource> sources) {
		Map<String, CompletableFuture<Document>> pending = new LinkedHashMap<>();
		for (TextSource source : sources) {
			pending.put(uniqueName(source.name(), pending.keySet()), readWithRetry(source, 1));
		}
		Map<String, Document> documents = new LinkedHashMap<>();
		List<String> failed = new ArrayList<>();
		for (Map.Entry<String, CompletableFuture<Document>> entry : pending.entrySet()) {
			try {
				documents.put(entry.getKey(), entry.getValue().join());
			} catch (CompletionException ex) {
				Throwable cause = unwrap(ex);
				logger.warn("Skipping text source {}: {}", entry.getKey(), cause.getMessage(), cause);
				failed.add(entry.getKey());
			}
		}
		if (!failed.isEmpty()) {
			logger.info("Read {} of {} text sources, skipped {}", documents.size(), pending.size(), failed);
		}
		return documents;
	}

	private CompletableFuture<Document> readWithRetry(TextSource source, int attempt) {
		return readOnce(source).exceptionallyCompose(ex -> {
			Throwable cause = unwrap(ex);
			if (!isRetryable(cause) || attempt >= retryPolicy.maxAttempts()) {
				if (attempt >= retryPolicy.maxAttempts() && isRetryable(cause)) {
					logger.error("Max attempts ({}) reached for text source {}", attempt, source.name());
				}
				return CompletableFuture.failedFuture(cause);
			}
			long delayMillis = retryPolicy.backoffFor(attempt).toMillis();
			logger.warn("Attempt {} for text source {} failed ({}), retrying in {} ms",
					attempt, source.name(), describe(cause), delayMillis);
			Executor delayed = CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS);
			return CompletableFuture.supplyAsync(() -> attempt + 1, delayed)
					.thenCompose(next -> readWithRetry(source, next));
		});
	}

	CompletableFuture<Document> readOnce(TextSource source) {
		CompletableFuture<Document> result = new CompletableFuture<>();
		long timeoutMillis = retryPolicy.attemptTimeout().toMillis();
		Future<?> task;
		try {
			task = executor.submit(() -> {
				if (result.isDone()) {
					return;
				}
				result.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
				try {
					result.complete(source.read());
				} catch (RuntimeException ex) {
					result.completeExceptionally(ex);
				}
			});
		} catch (RejectedExecutionException ex) {
			return CompletableFuture.failedFuture(
					new TextSourceException("Source executor rejected the read", source.name(), false, ex));
		}
		result.whenComplete((document, failure) -> {
			if (failure != null) {
				task.cancel(true);
			}
		});
		return result;
	}

	private static String describe(Throwable failure) {
		if (failure instanceof TimeoutException) {
			return "timed out";
		}
		return failure.getMessage();
	}

	static String uniqueName(String name, Set<String> taken) {
		String base = name == null || name.isBlank() ? "source" : name;
		String candidate = base;
		int suffix = 2;
		while (taken.contains(candidate)) {
			candidate = base + "#" + suffix++;
		}
		return candidate;
	}

	static boolean isRetryable(Throwable failure) {
		if (failure instanceof TimeoutException) {
			return true;
		}
		if (failure instanceof TextSourceException sourceFailure) {
			return sourceFailure.isRetryable();
		}
		return false;
	}

	private static Throwable unwrap(Throwable failure) {
		Throwable current = failure;
		while (current instanceof CompletionException && current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
