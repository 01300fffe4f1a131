package org.springaicommunity.content.checker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Watches a content directory and checks files as they are created or modified.
 *
 * <p>
 * Each event for a valid, supported file starts an independent task that runs the
 * {@link CheckInvoker} in {@link CheckMode#AUTOMATED} mode with the shared
 * {@link CancellationSignal}. Changes to a file that is already being checked are
 * coalesced into one more check after the running one, which absorbs the duplicate modify
 * events most platforms emit for one write without missing a later save.
 */
public class DirectoryWatchService {

	private static final Logger logger = LoggerFactory.getLogger(DirectoryWatchService.class);

	private static final long POLL_MILLIS = 200;

	private final CheckInvoker checkInvoker;

	private final ContentFileScanner fileScanner;

	private final BrowserLauncher browserLauncher;

	private final ExecutorService executor;

	private final boolean recursive;

	private final boolean openBrowser;

	// file being checked -> whether another change arrived during the check
	private final Map<Path, Boolean> inFlight = new ConcurrentHashMap<>();

	public DirectoryWatchService(CheckInvoker checkInvoker, ContentFileScanner fileScanner,
			BrowserLauncher browserLauncher, ExecutorService executor, boolean recursive, boolean openBrowser) {
		this.checkInvoker = checkInvoker;
		this.fileScanner = fileScanner;
		this.browserLauncher = browserLauncher;
		this.executor = executor;
		this.recursive = recursive;
		this.openBrowser = openBrowser;
	}

	/**
	 * Watch the directory until the signal fires. Blocks the calling thread.
	 * @param directory directory to watch
	 * @param signal shared cancellation signal, ends the watch when fired
	 * @throws ContentCheckException if the directory cannot be watched
	 */
	public void watch(Path directory, CancellationSignal signal) {
		Map<WatchKey, Path> keys = new ConcurrentHashMap<>();

		try (WatchService watchService = directory.getFileSystem().newWatchService()) {
			register(watchService, directory, keys);
			logger.info("Monitoring started for directory: {} ({} directories)", directory, keys.size());

			while (!signal.isCancelled() && !keys.isEmpty()) {
				WatchKey key = watchService.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
				if (key == null) {
					continue;
				}
				Path dir = keys.get(key);
				if (dir != null) {
					processEvents(key, dir, watchService, keys, signal);
				}
				if (!key.reset()) {
					keys.remove(key);
					logger.debug("Stopped watching {}", dir);
				}
			}
		}
		catch (IOException e) {
			throw new ContentCheckException(ErrorKind.FILE_NOT_READABLE, "Cannot watch directory: " + e.getMessage(),
					directory.toString(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.debug("Watch interrupted");
		}
		catch (ClosedWatchServiceException e) {
			logger.debug("Watch service closed");
		}
		logger.info("Monitoring stopped for directory: {}", directory);
	}

	private void processEvents(WatchKey key, Path dir, WatchService watchService, Map<WatchKey, Path> keys,
			CancellationSignal signal) {
		for (WatchEvent<?> event : key.pollEvents()) {
			WatchEvent.Kind<?> kind = event.kind();
			if (kind == StandardWatchEventKinds.OVERFLOW) {
				logger.warn("File events were lost in {}", dir);
				continue;
			}

			Path changed = dir.resolve((Path) event.context());
			if (Files.isDirectory(changed)) {
				if (recursive && kind == StandardWatchEventKinds.ENTRY_CREATE) {
					registerQuietly(watchService, changed, keys);
				}
				continue;
			}

			onFileChanged(changed, kind == StandardWatchEventKinds.ENTRY_CREATE ? "Created" : "Changed", signal);
		}
	}

	void onFileChanged(Path filePath, String changeType, CancellationSignal signal) {
		if (!fileScanner.isFileValid(filePath)) {
			logger.debug("File is not valid, skipping: {}", filePath);
			return;
		}
		if (!fileScanner.isFileSupported(filePath)) {
			logger.debug("File type not supported, skipping: {}", filePath);
			return;
		}
		boolean[] start = new boolean[1];
		inFlight.compute(filePath, (path, rerun) -> {
			start[0] = rerun == null;
			return rerun != null;
		});
		if (!start[0]) {
			logger.debug("Check already running for {}, checking again when it finishes", filePath);
			return;
		}

		logger.info("File {}: {}", changeType, filePath);
		executor.submit(() -> checkUntilSettled(filePath, signal));
	}

	boolean isChecking(Path filePath) {
		return inFlight.containsKey(filePath);
	}

	private void checkUntilSettled(Path filePath, CancellationSignal signal) {
		boolean settled = false;
		try {
			do {
				check(filePath, signal);
				if (signal.isCancelled()) {
					break;
				}
				settled = !rerunRequested(filePath);
			}
			while (!settled);
		}
		finally {
			if (!settled) {
				inFlight.remove(filePath);
			}
		}
	}

	/**
	 * Clears the entry unless another change arrived during the check, in which case the
	 * flag is reset and the caller checks once more.
	 */
	private boolean rerunRequested(Path filePath) {
		Boolean pending = inFlight.computeIfPresent(filePath, (path, rerun) -> rerun ? Boolean.FALSE : null);
		if (pending != null) {
			logger.info("File changed during its check, checking again: {}", filePath);
			return true;
		}
		return false;
	}

	private void check(Path filePath, CancellationSignal signal) {
		try {
			Optional<String> link = checkInvoker.check(filePath, null, CheckMode.AUTOMATED, signal);
			if (link.isEmpty()) {
				logger.warn("Check produced no scorecard for {}", filePath);
				return;
			}
			logger.info("Check completed successfully for {}: {}", filePath, link.get());
			if (openBrowser) {
				browserLauncher.open(link.get());
			}
		}
		catch (CheckCancelledException e) {
			logger.debug("Check of {} cancelled", filePath);
		}
		catch (RuntimeException e) {
			logger.error("Error processing file change for {}", filePath, e);
		}
	}

	private void register(WatchService watchService, Path directory, Map<WatchKey, Path> keys) throws IOException {
		if (!recursive) {
			keys.put(registerOne(watchService, directory), directory);
			return;
		}
		try (Stream<Path> dirs = Files.walk(directory)) {
			for (Path dir : (Iterable<Path>) dirs.filter(Files::isDirectory)::iterator) {
				keys.put(registerOne(watchService, dir), dir);
			}
		}
	}

	private void registerQuietly(WatchService watchService, Path directory, Map<WatchKey, Path> keys) {
		try {
			register(watchService, directory, keys);
			logger.debug("Watching new directory {}", directory);
		}
		catch (IOException e) {
			logger.warn("Cannot watch new directory {}: {}", directory, e.getMessage());
		}
	}

	private static WatchKey registerOne(WatchService watchService, Path directory) throws IOException {
		return directory.register(watchService, StandardWatchEventKinds.ENTRY_CREATE,
				StandardWatchEventKinds.ENTRY_MODIFY);
	}

}
