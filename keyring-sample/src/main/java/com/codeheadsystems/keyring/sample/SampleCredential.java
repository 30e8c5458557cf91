package com.codeheadsystems.keyring.sample;

import com.codeheadsystems.keyring.Entry;
import com.codeheadsystems.keyring.api.Credential;
import com.codeheadsystems.keyring.api.Specifiers;
import com.codeheadsystems.keyring.exceptions.AmbiguousException;
import com.codeheadsystems.keyring.exceptions.InvalidException;
import com.codeheadsystems.keyring.exceptions.NoEntryException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A credential in a {@link SampleStore}.
 * <p>
 * With a null uuid this is a <em>specifier</em>: every call looks at the bucket for its
 * service and user. An empty bucket means {@link NoEntryException} (except that setting a
 * secret creates the credential), a single credential is used directly, and more than one
 * raises {@link AmbiguousException} carrying a wrapper for each. Ambiguity is checked before
 * anything is written.
 * <p>
 * With a uuid this is a <em>wrapper</em>, pinned to that one credential. It never becomes
 * ambiguous and never re-targets: once its credential is deleted every call fails with
 * {@link NoEntryException}, even if the bucket later gains other credentials.
 * <p>
 * Attributes are {@value #UUID_ATTRIBUTE} (read-only), {@value #COMMENT_ATTRIBUTE}
 * (updatable) and {@value #CREATION_TIME_ATTRIBUTE} (read-only). Updating a read-only
 * attribute fails with {@link InvalidException}; unknown keys are ignored.
 */
public final class SampleCredential implements Credential {

  public static final String UUID_ATTRIBUTE = "uuid";
  public static final String COMMENT_ATTRIBUTE = "comment";
  public static final String CREATION_TIME_ATTRIBUTE = "creation_time";

  private final SampleStore store;
  private final CredentialId id;
  private final String uuid;

  SampleCredential(final SampleStore store, final CredentialId id, final String uuid) {
    this.store = store;
    this.id = id;
    this.uuid = uuid;
  }

  @Override
  public boolean isSpecifier() {
    return uuid == null;
  }

  public CredentialId id() {
    return id;
  }

  @Override
  public void setSecret(final byte[] secret) {
    byte[] copy = secret.clone();
    if (uuid != null) {
      ConcurrentHashMap<String, CredentialValue> bucket = store.bucket(id);
      if (bucket == null || bucket.computeIfPresent(uuid, (k, v) -> v.withSecret(copy)) == null) {
        throw new NoEntryException();
      }
      return;
    }
    ConcurrentHashMap<String, CredentialValue> bucket = store.bucketForWrite(id);
    // Serializes specifier writes on this id so two first writes cannot both create.
    synchronized (bucket) {
      List<String> uuids = new ArrayList<>(bucket.keySet());
      if (uuids.size() > 1) {
        throw ambiguous(uuids);
      }
      if (uuids.size() == 1
          && bucket.computeIfPresent(uuids.get(0), (k, v) -> v.withSecret(copy)) != null) {
        return;
      }
      // Empty bucket, or its only credential was deleted through a wrapper since the count.
      bucket.put(UUID.randomUUID().toString(), new CredentialValue(copy, null, null));
    }
  }

  @Override
  public byte[] getSecret() {
    return resolve().value().secret();
  }

  @Override
  public Map<String, String> getAttributes() {
    Resolved resolved = resolve();
    Map<String, String> attributes = new HashMap<>();
    attributes.put(UUID_ATTRIBUTE, resolved.uuid());
    if (resolved.value().comment() != null) {
      attributes.put(COMMENT_ATTRIBUTE, resolved.value().comment());
    }
    if (resolved.value().creationTime() != null) {
      attributes.put(CREATION_TIME_ATTRIBUTE, resolved.value().creationTime());
    }
    return attributes;
  }

  @Override
  public void updateAttributes(final Map<String, String> attributes) {
    for (String key : attributes.keySet()) {
      if (UUID_ATTRIBUTE.equals(key) || CREATION_TIME_ATTRIBUTE.equals(key)) {
        throw new InvalidException(key, "cannot be updated");
      }
    }
    Resolved resolved = resolve();
    String comment = attributes.get(COMMENT_ATTRIBUTE);
    if (comment == null) {
      return;
    }
    if (resolved.bucket().computeIfPresent(resolved.uuid(), (k, v) -> v.withComment(comment)) == null) {
      throw new NoEntryException();
    }
  }

  @Override
  public void deleteCredential() {
    Resolved resolved = resolve();
    if (resolved.bucket().remove(resolved.uuid()) == null) {
      throw new NoEntryException();
    }
  }

  @Override
  public Optional<Credential> getCredential() {
    if (uuid != null) {
      return Optional.empty();
    }
    return Optional.of(new SampleCredential(store, id, resolve().uuid()));
  }

  @Override
  public Optional<Specifiers> getSpecifiers() {
    return Optional.of(new Specifiers(id.service(), id.user()));
  }

  /**
   * The uuid of the credential this resolves to.
   *
   * @return the uuid
   */
  public String getUuid() {
    return resolve().uuid();
  }

  /**
   * The comment of the credential this resolves to.
   *
   * @return the comment, if it has one
   */
  public Optional<String> getComment() {
    return Optional.ofNullable(resolve().value().comment());
  }

  /**
   * The creation time of the credential this resolves to.
   *
   * @return the creation time, for credentials made with the force-create modifier
   */
  public Optional<String> getCreationTime() {
    return Optional.ofNullable(resolve().value().creationTime());
  }

  private Resolved resolve() {
    ConcurrentHashMap<String, CredentialValue> bucket = store.bucket(id);
    if (bucket == null) {
      throw new NoEntryException();
    }
    if (uuid != null) {
      CredentialValue value = bucket.get(uuid);
      if (value == null) {
        throw new NoEntryException();
      }
      return new Resolved(bucket, uuid, value);
    }
    List<Map.Entry<String, CredentialValue>> matches = new ArrayList<>(bucket.entrySet());
    if (matches.isEmpty()) {
      throw new NoEntryException();
    }
    if (matches.size() > 1) {
      throw ambiguous(matches.stream().map(Map.Entry::getKey).toList());
    }
    return new Resolved(bucket, matches.get(0).getKey(), matches.get(0).getValue());
  }

  private AmbiguousException ambiguous(final List<String> uuids) {
    return new AmbiguousException(uuids.stream()
        .map(u -> Entry.fromCredential(new SampleCredential(store, id, u)))
        .toList());
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof SampleCredential other
        && store == other.store
        && id.equals(other.id)
        && Objects.equals(uuid, other.uuid);
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(store), id, uuid);
  }

  @Override
  public String toString() {
    return "SampleCredential{store=" + store.id() + ", service=" + id.service()
        + ", user=" + id.user() + ", uuid=" + uuid + "}";
  }

  private record Resolved(ConcurrentHashMap<String, CredentialValue> bucket,
                          String uuid,
                          CredentialValue value) {
  }
}
