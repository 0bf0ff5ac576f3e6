package my.statementfusion.app.importer;

import my.statementfusion.app.model.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TextSourceReaderTest {
	private final ExecutorService executor = Executors.newFixedThreadPool(4);
	private final RetryPolicy fastRetry = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(20),
			Duration.ofMillis(500));

	@AfterEach
	void shutdown() {
		executor.shutdownNow();
	}

	@Test
	void retriesRetryableFailureUntilItSucceeds() {
		FlakySource flaky = new FlakySource("flaky", 2, true);
		TextSourceReader reader = new TextSourceReader(executor, fastRetry);

		Map<String, Document> documents = reader.readAll(List.of(flaky, new InMemoryTextSource("memory", "XS1234567890")));

		assertThat(documents).containsOnlyKeys("flaky", "memory");
		assertThat(flaky.attempts.get()).isEqualTo(3);
		assertThat(documents.get("flaky").text(0)).isEqualTo("recovered");
	}

	@Test
	void skipsSourceAfterMaxAttempts() {
		FlakySource broken = new FlakySource("broken", Integer.MAX_VALUE, true);
		TextSourceReader reader = new TextSourceReader(executor, fastRetry);

		Map<String, Document> documents = reader.readAll(List.of(broken, new InMemoryTextSource("memory", "text")));

		assertThat(documents).containsOnlyKeys("memory");
		assertThat(broken.attempts.get()).isEqualTo(3);
	}

	@Test
	void doesNotRetryPermanentFailure() {
		FlakySource permanent = new FlakySource("permanent", Integer.MAX_VALUE, false);
		TextSourceReader reader = new TextSourceReader(executor, fastRetry);

		assertThat(reader.readAll(List.of(permanent))).isEmpty();
		assertThat(permanent.attempts.get()).isEqualTo(1);
	}

	@Test
	void attemptThatTimesOutIsRetried() {
		AtomicInteger attempts = new AtomicInteger();
		TextSource slowOnce = new TextSource() {
			@Override
			public String name() {
				return "slow-once";
			}

			@Override
			public Document read() {
				if (attempts.incrementAndGet() == 1) {
					try {
						Thread.sleep(2_000);
					} catch (InterruptedException ex) {
						Thread.currentThread().interrupt();
					}
				}
				return Document.fromText(name(), "done");
			}
		};
		TextSourceReader reader = new TextSourceReader(executor, new RetryPolicy(2, Duration.ofMillis(10),
				Duration.ofMillis(10), Duration.ofMillis(200)));

		Map<String, Document> documents = reader.readAll(List.of(slowOnce));

		assertThat(documents).containsOnlyKeys("slow-once");
		assertThat(attempts.get()).isEqualTo(2);
	}

	@Test
	void hungSourcesDoNotStarveHealthySibling() {
		ExecutorService twoThreads = Executors.newFixedThreadPool(2);
		try {
			TextSourceReader reader = new TextSourceReader(twoThreads, new RetryPolicy(3, Duration.ofMillis(10),
					Duration.ofMillis(10), Duration.ofMillis(200)));
			HangingSource first = new HangingSource("hung-a");
			HangingSource second = new HangingSource("hung-b");

			Map<String, Document> documents = reader.readAll(List.of(first, second,
					new InMemoryTextSource("healthy", "XS1234567890 199'080.00")));

			assertThat(documents).containsOnlyKeys("healthy");
			assertThat(first.attempts.get()).isEqualTo(3);
			assertThat(second.attempts.get()).isEqualTo(3);
			assertThat(reader.readAll(List.of(new InMemoryTextSource("next-run", "text"))))
					.containsOnlyKeys("next-run");
		} finally {
			twoThreads.shutdownNow();
		}
	}

	@Test
	void duplicateSourceNamesStayDistinct() {
		TextSourceReader reader = new TextSourceReader(executor, fastRetry);

		Map<String, Document> documents = reader.readAll(List.of(
				new InMemoryTextSource("scan", "a"),
				new InMemoryTextSource("scan", "b")));

		assertThat(documents).containsOnlyKeys("scan", "scan#2");
		assertThat(TextSourceReader.uniqueName(null, Set.of())).isEqualTo("source");
	}

	@Test
	void backoffGrowsExponentiallyUpToMaximum() {
		RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(350), null);

		assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofMillis(100));
		assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofMillis(200));
		assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofMillis(350));
		assertThat(policy.attemptTimeout()).isEqualTo(RetryPolicy.DEFAULT_ATTEMPT_TIMEOUT);
		assertThat(new RetryPolicy(0, null, null, null).maxAttempts()).isEqualTo(1);
	}

	private static final class HangingSource implements TextSource {
		private final String name;
		private final AtomicInteger attempts = new AtomicInteger();

		private HangingSource(String name) {
			this.name = name;
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public Document read() {
			attempts.incrementAndGet();
			try {
				Thread.sleep(10_000);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				throw new TextSourceException("interrupted", name, true, null);
			}
			return Document.fromText(name, "too late");
		}
	}

	private static final class FlakySource implements TextSource {
		private final String name;
		private final int failures;
		private final boolean retryable;
		private final AtomicInteger attempts = new AtomicInteger();

		private FlakySource(String name, int failures, boolean retryable) {
			this.name = name;
			this.failures = failures;
			this.retryable = retryable;
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public Document read() {
			if (attempts.incrementAndGet() <= failures) {
				throw new TextSourceException("unavailable", name, retryable, new IOException("disk busy"));
			}
			return Document.fromText(name, "recovered");
		}
	}
}
