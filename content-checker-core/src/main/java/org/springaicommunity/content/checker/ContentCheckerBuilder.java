package org.springaicommunity.content.checker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Builder wiring the content checking services.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Configuration from ACROLINX_* environment variables
 * ContentCheckerBuilder builder = ContentCheckerBuilder.create().configurationFromEnv();
 * BatchSummary summary = builder.buildBatchService()
 *     .runBatch(builder.getConfiguration(), null, CancellationSignal.create());
 *
 * // With custom properties
 * CheckerProperties props = new CheckerProperties();
 * props.setMaxConcurrency(4);
 *
 * BatchCheckService service = ContentCheckerBuilder.create()
 *     .configuration(configuration)
 *     .properties(props)
 *     .buildBatchService();
 *
 * // For testing with a mock platform client
 * PlatformClient mockClient = mock(PlatformClient.class);
 * ThrottledBatchDispatcher dispatcher = ContentCheckerBuilder.create()
 *     .platformClient(mockClient)
 *     .buildDispatcher();
 * }
 * </pre>
 */
public class ContentCheckerBuilder {

	private @Nullable CheckerConfiguration configuration;

	private CheckerProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable PlatformClient platformClient;

	private @Nullable CheckInvoker checkInvoker;

	private @Nullable BrowserLauncher browserLauncher;

	private @Nullable ExecutorService executor;

	private @Nullable Consumer<RetryAttempt> retryListener;

	private ContentCheckerBuilder() {
		this.properties = new CheckerProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ContentCheckerBuilder
	 */
	public static ContentCheckerBuilder create() {
		return new ContentCheckerBuilder();
	}

	/**
	 * Set the configuration directly.
	 * @param configuration loaded configuration
	 * @return this builder
	 */
	public ContentCheckerBuilder configuration(CheckerConfiguration configuration) {
		this.configuration = configuration;
		return this;
	}

	/**
	 * Load the configuration from the {@code ACROLINX_*} environment variables.
	 * @return this builder
	 * @throws ConfigurationException if the configuration is invalid
	 */
	public ContentCheckerBuilder configurationFromEnv() {
		this.configuration = new ConfigurationLoader().load().validateOrThrow();
		return this;
	}

	/**
	 * Set checker properties.
	 * @param properties tunables (null to use defaults)
	 * @return this builder
	 */
	public ContentCheckerBuilder properties(@Nullable CheckerProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ContentCheckerBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom PlatformClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, the platform URL and client signature are not
	 * required.
	 * @param platformClient custom client (null to use the HTTP client)
	 * @return this builder
	 */
	public ContentCheckerBuilder platformClient(@Nullable PlatformClient platformClient) {
		this.platformClient = platformClient;
		return this;
	}

	/**
	 * Set a custom CheckInvoker, bypassing the platform client entirely.
	 * @param checkInvoker custom invoker (null to use the platform invoker)
	 * @return this builder
	 */
	public ContentCheckerBuilder checkInvoker(@Nullable CheckInvoker checkInvoker) {
		this.checkInvoker = checkInvoker;
		return this;
	}

	/**
	 * Set a custom BrowserLauncher.
	 * @param browserLauncher launcher (null to use the desktop browser)
	 * @return this builder
	 */
	public ContentCheckerBuilder browserLauncher(@Nullable BrowserLauncher browserLauncher) {
		this.browserLauncher = browserLauncher;
		return this;
	}

	/**
	 * Set the executor that runs check tasks.
	 * @param executor executor (null for a dedicated daemon pool)
	 * @return this builder
	 */
	public ContentCheckerBuilder executor(@Nullable ExecutorService executor) {
		this.executor = executor;
		return this;
	}

	/**
	 * Set a listener notified of every scheduled retry.
	 * @param retryListener listener (null for none)
	 * @return this builder
	 */
	public ContentCheckerBuilder retryListener(@Nullable Consumer<RetryAttempt> retryListener) {
		this.retryListener = retryListener;
		return this;
	}

	public @Nullable CheckerConfiguration getConfiguration() {
		return configuration;
	}

	public CheckerProperties getProperties() {
		return properties;
	}

	/**
	 * Build the single-file check invoker.
	 * @return configured CheckInvoker
	 */
	public CheckInvoker buildCheckInvoker() {
		if (checkInvoker != null) {
			return checkInvoker;
		}
		CheckerConfiguration config = requireConfiguration();

		PlatformClient client = platformClient;
		if (client == null) {
			ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
			client = new PlatformHttpClient(requireValue(config.remoteUrl(), "Acrolinx URL"),
					requireValue(config.clientSignature(), "client signature"), mapper);
		}

		RetryExecutor.Builder retryBuilder = RetryExecutor.builder();
		if (retryListener != null) {
			retryBuilder.retryListener(retryListener);
		}

		return new PlatformCheckInvoker(client, retryBuilder.build(), requireValue(config.apiToken(), "SSO token"),
				requireValue(config.username(), "username"), properties.remoteRetryPolicy(),
				RetryPolicy.fileOperation(), properties.getMaxFileSizeBytes());
	}

	/**
	 * Build the throttled batch dispatcher.
	 * @return configured ThrottledBatchDispatcher
	 */
	public ThrottledBatchDispatcher buildDispatcher() {
		ThrottledBatchDispatcher.Builder builder = ThrottledBatchDispatcher.builder(buildCheckInvoker())
			.maxConcurrency(properties.getMaxConcurrency())
			.pacingDelay(Duration.ofMillis(properties.getPacingDelayMillis()));
		if (executor != null) {
			builder.executor(executor);
		}
		return builder.build();
	}

	/**
	 * Build the batch check service.
	 * @return configured BatchCheckService
	 */
	public BatchCheckService buildBatchService() {
		return new BatchCheckService(buildDispatcher(), new ContentFileScanner(), new BatchIdGenerator(),
				resolveBrowserLauncher(), properties);
	}

	/**
	 * Build the directory watch service.
	 * @return configured DirectoryWatchService
	 */
	public DirectoryWatchService buildWatchService() {
		ExecutorService watchExecutor = executor != null ? executor
				: Executors.newCachedThreadPool(ThrottledBatchDispatcher.daemonThreads("content-watch-"));
		return new DirectoryWatchService(buildCheckInvoker(), new ContentFileScanner(), resolveBrowserLauncher(),
				watchExecutor, properties.isRecursive(), properties.isOpenBrowser());
	}

	private BrowserLauncher resolveBrowserLauncher() {
		return browserLauncher != null ? browserLauncher : new DesktopBrowserLauncher();
	}

	private CheckerConfiguration requireConfiguration() {
		if (configuration == null) {
			throw new IllegalStateException(
					"Configuration is required. Call configuration() or configurationFromEnv() first.");
		}
		if (platformClient == null) {
			configuration.validateOrThrow();
		}
		return configuration;
	}

	private static String requireValue(@Nullable String value, String name) {
		if (value == null || value.isBlank()) {
			throw new ConfigurationException(List.of("Missing " + name));
		}
		return value;
	}

}
