package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File system implementation of {@link ArchiveLedger}.
 *
 * <p>
 * The ledger is a pretty-printed JSON array of strings. Every insert re-reads the file,
 * adds the key and rewrites the whole file. All reads and writes of one instance are
 * serialized behind a single lock, so concurrent download workers of the same run cannot
 * lose each other's inserts. Writers in other processes are not coordinated, and a crash
 * in the middle of a rewrite can leave a truncated file behind; the next run then fails
 * with an {@link ArchiveLedgerException} instead of silently starting over.
 */
public class FileSystemArchiveLedger implements ArchiveLedger {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemArchiveLedger.class);

	private static final TypeReference<List<String>> KEY_LIST = new TypeReference<>() {
	};

	private final Path path;

	private final ObjectMapper objectMapper;

	private final ReentrantLock lock = new ReentrantLock();

	public FileSystemArchiveLedger(Path path, ObjectMapper objectMapper) {
		this.path = path.toAbsolutePath().normalize();
		this.objectMapper = objectMapper;
	}

	/**
	 * Read the ledger file.
	 * @return the recorded keys in file order, empty if the file does not exist
	 * @throws ArchiveLedgerException if the file exists but is not a JSON array of strings
	 */
	public Set<String> load() {
		lock.lock();
		try {
			return read();
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public boolean contains(String key) {
		return load().contains(key);
	}

	@Override
	public void insert(String key) {
		lock.lock();
		try {
			Set<String> keys = read();
			if (!keys.add(key)) {
				logger.debug("Archive already contains {}", key);
			}
			write(keys);
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public Set<String> keys() {
		return Collections.unmodifiableSet(load());
	}

	@Override
	public Path path() {
		return path;
	}

	private Set<String> read() {
		if (!Files.exists(path)) {
			return new LinkedHashSet<>();
		}
		try {
			List<String> keys = objectMapper.readValue(path.toFile(), KEY_LIST);
			if (keys == null) {
				throw new ArchiveLedgerException("Archive file is empty or null", path, null);
			}
			return new LinkedHashSet<>(keys);
		}
		catch (JsonProcessingException e) {
			throw new ArchiveLedgerException("Archive file is not a JSON list of keys", path, e);
		}
		catch (IOException e) {
			throw new ArchiveLedgerException("Unable to read archive file", path, e);
		}
	}

	private void write(Set<String> keys) {
		try {
			Path parent = path.getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), keys);
		}
		catch (IOException e) {
			throw new ArchiveLedgerException("Error writing to archive", path, e);
		}
	}

}
