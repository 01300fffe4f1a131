package org.springaicommunity.content.checker;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Generates batch ids of the form {@code batch-yyyyMMdd-HHmmss} from the current UTC time.
 */
public class BatchIdGenerator {

	private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
		.withZone(ZoneOffset.UTC);

	private final Clock clock;

	public BatchIdGenerator() {
		this(Clock.systemUTC());
	}

	public BatchIdGenerator(Clock clock) {
		this.clock = clock;
	}

	public String generate() {
		return "batch-" + FORMAT.format(clock.instant());
	}

}
