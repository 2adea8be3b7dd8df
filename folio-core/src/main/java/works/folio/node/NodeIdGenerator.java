package works.folio.node;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Supplies fresh node ids.
 * <p>
 * Generators are ordinary objects owned by whoever creates them,
 * typically via {@link works.folio.DocumentConfig}; there is no process-wide counter.
 */
@FunctionalInterface
public interface NodeIdGenerator {
	String nextId();

	/**
	 * @return a generator producing {@code prefix + "0"}, {@code prefix + "1"}, and so on,
	 * with its own counter
	 */
	static NodeIdGenerator sequential(String prefix) {
		requireNonNull(prefix);
		AtomicLong counter = new AtomicLong();
		return () -> prefix + counter.getAndIncrement();
	}

	/**
	 * @return a generator producing random (version 4) UUID strings
	 */
	static NodeIdGenerator random() {
		return () -> UUID.randomUUID().toString();
	}
}
