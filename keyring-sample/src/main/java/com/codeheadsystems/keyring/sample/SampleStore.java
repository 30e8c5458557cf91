package com.codeheadsystems.keyring.sample;

import com.codeheadsystems.keyring.Entry;
import com.codeheadsystems.keyring.api.CredentialPersistence;
import com.codeheadsystems.keyring.api.CredentialStore;
import com.codeheadsystems.keyring.exceptions.InvalidException;
import com.codeheadsystems.keyring.exceptions.KeyringException;
import com.codeheadsystems.keyring.util.Attributes;
import java.lang.ref.Cleaner;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference credential store kept in memory, optionally snapshotted to a backing file.
 * <p>
 * Credentials are held in a two-level concurrent map: {@link CredentialId} to bucket, and
 * within a bucket uuid to {@link CredentialValue}. Buckets are created on first write and
 * are never removed; deleting a credential only removes it from its bucket.
 * <p>
 * The backing file is read once, when the store is created, and written only by
 * {@link #save()}, {@link #close()}, or after the store becomes unreachable (which requires
 * every entry built from it to be unreachable too, since credentials hold their store).
 * Changes made since the last save are lost on a crash. Stores sharing a backing file do
 * not coordinate and overwrite each other's snapshots. Callers must not mutate the store
 * while a save is running.
 * <p>
 * <strong>Modifiers:</strong> {@value #FORCE_CREATE} makes {@link #build} immediately add a
 * new credential with an empty secret, a {@code comment} equal to the modifier value and a
 * {@code creation_time} stamp, and return a wrapper pinned to it. If the bucket already held
 * credentials, the specification is now ambiguous. {@value #TARGET} is accepted as another
 * name for the same modifier, but not together with it. Any other modifier is rejected.
 * <p>
 * Not secure and not meant for production: it exists to test client code and as a template
 * for writing stores.
 */
public class SampleStore implements CredentialStore, AutoCloseable {

  public static final String VENDOR = "keyring-core-sample";
  public static final String FORCE_CREATE = "force-create";
  /**
   * Older name of {@link #FORCE_CREATE}, sent by {@link Entry#createWithTarget}.
   */
  public static final String TARGET = "target";

  private static final Logger log = LoggerFactory.getLogger(SampleStore.class);
  private static final Set<String> MODIFIERS = Set.of(FORCE_CREATE, TARGET);
  private static final AtomicInteger NEXT_INDEX = new AtomicInteger();
  private static final Cleaner CLEANER = Cleaner.create();

  private final int index;
  private final ConcurrentHashMap<CredentialId, ConcurrentHashMap<String, CredentialValue>> credentials;
  private final Path backingFile;
  private final StoreCodec codec;
  private final FinalSave finalSave;
  private final Cleaner.Cleanable cleanable;

  private SampleStore(final ConcurrentHashMap<CredentialId, ConcurrentHashMap<String, CredentialValue>> credentials,
                      final Path backingFile,
                      final StoreCodec codec) {
    this.index = NEXT_INDEX.getAndIncrement();
    this.credentials = credentials;
    this.backingFile = backingFile;
    this.codec = codec;
    // The cleanup action must not reference this store, or it would never become unreachable.
    this.finalSave = new FinalSave(id(), credentials, backingFile, codec);
    this.cleanable = CLEANER.register(this, finalSave);
  }

  /**
   * Creates an empty store with no backing file.
   *
   * @return the store
   */
  public static SampleStore inMemory() {
    return create(SampleStoreConfig.inMemory());
  }

  /**
   * Creates a store from a backing file, which need not exist yet.
   *
   * @param backingFile the backing file
   * @return the store
   * @throws com.codeheadsystems.keyring.exceptions.PlatformFailureException if the file exists
   *     but cannot be read or decoded
   */
  public static SampleStore withBackingFile(final Path backingFile) {
    return create(SampleStoreConfig.withBackingFile(backingFile));
  }

  /**
   * Creates a store from a configuration map, see {@link SampleStoreConfig#fromMap}.
   *
   * @param settings the settings
   * @return the store
   */
  public static SampleStore withConfiguration(final Map<String, String> settings) {
    return create(SampleStoreConfig.fromMap(settings));
  }

  /**
   * Creates a store.
   *
   * @param config the configuration
   * @return the store
   */
  public static SampleStore create(final SampleStoreConfig config) {
    StoreCodec codec = new StoreCodec();
    if (config.backingFile() == null) {
      SampleStore store = new SampleStore(new ConcurrentHashMap<>(), null, codec);
      log.warn("Created {} without a backing file: credentials will NOT survive this process.",
          store.id());
      return store;
    }
    SampleStore store = new SampleStore(codec.read(config.backingFile()), config.backingFile(), codec);
    log.debug("Loaded {} with {} credential(s) from {}",
        store.id(), store.credentialCount(), config.backingFile());
    return store;
  }

  @Override
  public String vendor() {
    return VENDOR;
  }

  @Override
  public String id() {
    return "sample-store-" + index;
  }

  @Override
  public Entry build(final String service, final String user, final Map<String, String> modifiers) {
    if (service == null) {
      throw new InvalidException("service", "must not be null");
    }
    if (user == null) {
      throw new InvalidException("user", "must not be null");
    }
    Map<String, String> parsed = Attributes.parse(MODIFIERS, modifiers);
    CredentialId id = new CredentialId(service, user);
    if (parsed.containsKey(FORCE_CREATE) && parsed.containsKey(TARGET)) {
      throw new InvalidException(TARGET, "cannot be combined with " + FORCE_CREATE);
    }
    String comment = parsed.containsKey(FORCE_CREATE) ? parsed.get(FORCE_CREATE) : parsed.get(TARGET);
    if (comment == null) {
      return Entry.fromCredential(new SampleCredential(this, id, null));
    }
    String uuid = UUID.randomUUID().toString();
    String creationTime = ZonedDateTime.now().format(DateTimeFormatter.RFC_1123_DATE_TIME);
    bucketForWrite(id).put(uuid, new CredentialValue(new byte[0], comment, creationTime));
    log.debug("build() force-created credential {} for {}", uuid, id);
    return Entry.fromCredential(new SampleCredential(this, id, uuid));
  }

  /**
   * Full scan of the store, see {@link CredentialSearch} for the specification format.
   *
   * @param spec the search specification
   * @return one wrapper entry per matching credential
   */
  @Override
  public List<Entry> search(final Map<String, String> spec) {
    CredentialSearch search = CredentialSearch.compile(spec);
    List<Entry> result = new ArrayList<>();
    credentials.forEach((id, bucket) -> bucket.forEach((uuid, value) -> {
      if (search.matches(id, uuid, value)) {
        result.add(Entry.fromCredential(new SampleCredential(this, id, uuid)));
      }
    }));
    log.debug("search({}) found {} credential(s)", spec.keySet(), result.size());
    return result;
  }

  @Override
  public CredentialPersistence persistence() {
    return backingFile == null ? CredentialPersistence.PROCESS_ONLY : CredentialPersistence.UNTIL_DELETE;
  }

  /**
   * Writes a snapshot of every credential to the backing file. Does nothing without one.
   *
   * @throws com.codeheadsystems.keyring.exceptions.PlatformFailureException if writing fails
   */
  public void save() {
    writeSnapshot(backingFile, credentials, codec);
  }

  /**
   * Saves the store one last time and cancels the save that would otherwise happen once it
   * becomes unreachable. The store stays usable; later changes need an explicit
   * {@link #save()}.
   */
  @Override
  public void close() {
    finalSave.saveNow();
    cleanable.clean();
  }

  public Path backingFile() {
    return backingFile;
  }

  /**
   * The number of credentials across all buckets.
   *
   * @return the count
   */
  public int credentialCount() {
    return credentials.values().stream().mapToInt(Map::size).sum();
  }

  ConcurrentHashMap<String, CredentialValue> bucket(final CredentialId id) {
    return credentials.get(id);
  }

  ConcurrentHashMap<String, CredentialValue> bucketForWrite(final CredentialId id) {
    return credentials.computeIfAbsent(id, k -> new ConcurrentHashMap<>());
  }

  private static void writeSnapshot(final Path backingFile,
                                    final Map<CredentialId, ConcurrentHashMap<String, CredentialValue>> credentials,
                                    final StoreCodec codec) {
    if (backingFile == null) {
      return;
    }
    codec.write(backingFile, credentials);
    log.debug("Saved credentials to {}", backingFile);
  }

  @Override
  public String toString() {
    return "SampleStore{id=" + id() + ", backing=" + backingFile + ", credentials=" + credentialCount() + "}";
  }

  // Runs at most once: from close(), or from the cleaner thread once the store is unreachable.
  private static final class FinalSave implements Runnable {

    private final String storeId;
    private final Map<CredentialId, ConcurrentHashMap<String, CredentialValue>> credentials;
    private final Path backingFile;
    private final StoreCodec codec;
    private final AtomicBoolean done = new AtomicBoolean();

    private FinalSave(final String storeId,
                      final Map<CredentialId, ConcurrentHashMap<String, CredentialValue>> credentials,
                      final Path backingFile,
                      final StoreCodec codec) {
      this.storeId = storeId;
      this.credentials = credentials;
      this.backingFile = backingFile;
      this.codec = codec;
    }

    void saveNow() {
      if (done.compareAndSet(false, true)) {
        log.debug("Saving {} on close...", storeId);
        writeSnapshot(backingFile, credentials, codec);
      }
    }

    @Override
    public void run() {
      if (!done.compareAndSet(false, true)) {
        return;
      }
      log.debug("Saving {} on release...", storeId);
      try {
        writeSnapshot(backingFile, credentials, codec);
      } catch (KeyringException e) {
        // Nobody is left to rethrow to.
        log.error("Save of {} to {} failed", storeId, backingFile, e);
      }
    }
  }
}
