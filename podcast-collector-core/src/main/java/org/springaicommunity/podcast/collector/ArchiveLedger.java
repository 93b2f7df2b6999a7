package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Set;

/**
 * Persisted set of archive keys marking artifacts that were already handled.
 *
 * <p>
 * One handle is created per run and passed to every component that needs it. All
 * implementations must tolerate concurrent callers within one process.
 */
public interface ArchiveLedger {

	/**
	 * Check whether a key has been recorded.
	 * @param key the archive key
	 * @return true if the key is present
	 * @throws ArchiveLedgerException if the persisted ledger cannot be read
	 */
	boolean contains(String key);

	/**
	 * Record a key. Inserting an existing key is a no-op.
	 * @param key the archive key
	 * @throws ArchiveLedgerException if the ledger cannot be read or written
	 */
	void insert(String key);

	/**
	 * Snapshot of all recorded keys in insertion order.
	 * @return the recorded keys
	 */
	Set<String> keys();

	/**
	 * Location of the persisted ledger.
	 * @return the ledger path, or null if the ledger is not persisted
	 */
	@Nullable
	Path path();

	/**
	 * Whether this ledger records anything at all.
	 * @return false for the {@link #disabled()} ledger
	 */
	default boolean isEnabled() {
		return true;
	}

	/**
	 * A ledger that never contains anything and ignores inserts, used when no archive
	 * is configured.
	 * @return the disabled ledger
	 */
	static ArchiveLedger disabled() {
		return DisabledArchiveLedger.INSTANCE;
	}

}
