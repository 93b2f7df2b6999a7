package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Set;

/**
 * {@link ArchiveLedger} used when no archive file is configured.
 */
final class DisabledArchiveLedger implements ArchiveLedger {

	static final DisabledArchiveLedger INSTANCE = new DisabledArchiveLedger();

	private DisabledArchiveLedger() {
	}

	@Override
	public boolean contains(String key) {
		return false;
	}

	@Override
	public void insert(String key) {
	}

	@Override
	public Set<String> keys() {
		return Set.of();
	}

	@Override
	@Nullable
	public Path path() {
		return null;
	}

	@Override
	public boolean isEnabled() {
		return false;
	}

}
