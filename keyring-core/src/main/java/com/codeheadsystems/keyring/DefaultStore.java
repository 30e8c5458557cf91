package com.codeheadsystems.keyring;

import com.codeheadsystems.keyring.api.CredentialStore;
import com.codeheadsystems.keyring.exceptions.NoDefaultStoreException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The process-wide default credential store, consulted by {@link Entry#create} and friends.
 * <p>
 * Set it once at application startup, before entries are created. {@link #set} waits for
 * any in-flight entry creation to finish. Tests that use the default store must set and
 * unset it themselves.
 */
public class DefaultStore {

  private static final Logger log = LoggerFactory.getLogger(DefaultStore.class);

  private static final ReadWriteLock LOCK = new ReentrantReadWriteLock();
  private static CredentialStore store;

  private DefaultStore() {
  }

  /**
   * Replaces the default store.
   *
   * @param newStore the store to use from now on
   */
  public static void set(final CredentialStore newStore) {
    log.debug("set({})", newStore);
    LOCK.writeLock().lock();
    try {
      store = newStore;
    } finally {
      LOCK.writeLock().unlock();
    }
  }

  /**
   * Forgets the default store.
   *
   * @return the store that was set, if any
   */
  public static Optional<CredentialStore> unset() {
    log.debug("unset()");
    LOCK.writeLock().lock();
    try {
      CredentialStore previous = store;
      store = null;
      return Optional.ofNullable(previous);
    } finally {
      LOCK.writeLock().unlock();
    }
  }

  /**
   * The current default store.
   *
   * @return the store, if one is set
   */
  public static Optional<CredentialStore> get() {
    LOCK.readLock().lock();
    try {
      return Optional.ofNullable(store);
    } finally {
      LOCK.readLock().unlock();
    }
  }

  static Entry build(final String service, final String user, final Map<String, String> modifiers) {
    return withStore(s -> s.build(service, user, modifiers));
  }

  // Holds the read lock for the whole call so set() cannot swap the store underneath it.
  static <T> T withStore(final Function<CredentialStore, T> action) {
    LOCK.readLock().lock();
    try {
      if (store == null) {
        throw new NoDefaultStoreException();
      }
      return action.apply(store);
    } finally {
      LOCK.readLock().unlock();
    }
  }
}
