package com.codeheadsystems.keyring.sample;

import com.codeheadsystems.keyring.exceptions.InvalidException;
import com.codeheadsystems.keyring.util.Attributes;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of a {@link SampleStore}.
 * <p>
 * Without a backing file the store lives only in memory. With one, the store is loaded
 * from the file when created (a missing file means an empty store) and written back on
 * {@link SampleStore#save()}, on {@link SampleStore#close()}, or once the store is no longer
 * reachable.
 *
 * @param backingFile the backing file, or null for an in-memory store
 */
public record SampleStoreConfig(Path backingFile) {

  /**
   * Configuration-map key naming the backing file.
   */
  public static final String BACKING_FILE = "backing-file";

  public static SampleStoreConfig inMemory() {
    return new SampleStoreConfig(null);
  }

  public static SampleStoreConfig withBackingFile(final Path backingFile) {
    return new SampleStoreConfig(backingFile);
  }

  /**
   * Builds a configuration from string settings. The only accepted key is
   * {@value #BACKING_FILE}.
   *
   * @param settings the settings, may be null
   * @return the configuration
   * @throws InvalidException for an unknown key or an unusable path
   */
  public static SampleStoreConfig fromMap(final Map<String, String> settings) {
    Map<String, String> parsed = Attributes.parse(Set.of(BACKING_FILE), settings);
    String backing = parsed.get(BACKING_FILE);
    if (backing == null) {
      return inMemory();
    }
    try {
      return withBackingFile(Path.of(backing));
    } catch (InvalidPathException e) {
      throw new InvalidException(BACKING_FILE, e.getReason(), e);
    }
  }
}
