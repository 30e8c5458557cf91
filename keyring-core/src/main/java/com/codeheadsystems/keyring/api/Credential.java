package com.codeheadsystems.keyring.api;

import com.codeheadsystems.keyring.exceptions.AmbiguousException;
import com.codeheadsystems.keyring.exceptions.BadEncodingException;
import com.codeheadsystems.keyring.exceptions.NoEntryException;
import com.codeheadsystems.keyring.exceptions.NotSupportedByStoreException;
import com.codeheadsystems.keyring.util.Secrets;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Operations on a single credential, as implemented by a credential store.
 * <p>
 * A credential object is either a <em>specifier</em>, which names a credential by its
 * service and user and is resolved by the store on every call, or a <em>wrapper</em>, which
 * is pinned to one existing credential. Only specifiers can create a credential when a
 * secret is set; wrappers fail with {@link NoEntryException} once their credential is gone.
 * <p>
 * Implementations must be thread-safe: one credential object may be shared by many
 * {@link com.codeheadsystems.keyring.Entry} instances and used from many threads at once.
 */
public interface Credential {

  /**
   * Stores the UTF-8 encoding of the given password as the secret.
   *
   * @param password the password
   */
  default void setPassword(final String password) {
    setSecret(password.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Stores the given bytes as the secret, creating the credential if this is a specifier
   * and nothing matches it yet.
   *
   * @param secret the secret
   * @throws AmbiguousException if the specification matches more than one credential
   * @throws NoEntryException   if this is a wrapper whose credential no longer exists
   */
  void setSecret(byte[] secret);

  /**
   * Reads the secret and decodes it as UTF-8.
   *
   * @return the password
   * @throws BadEncodingException if the secret is not valid UTF-8
   */
  default String getPassword() {
    return Secrets.decodePassword(getSecret());
  }

  /**
   * Reads the secret.
   *
   * @return a copy of the secret bytes
   * @throws NoEntryException   if nothing matches
   * @throws AmbiguousException if more than one credential matches
   */
  byte[] getSecret();

  /**
   * Reads the store-specific attributes of the credential.
   * <p>
   * Stores without attributes return an empty map, but fail in the same cases as
   * {@link #getSecret()}.
   *
   * @return the attributes
   */
  default Map<String, String> getAttributes() {
    getSecret();
    return Map.of();
  }

  /**
   * Updates attributes of an existing credential. Never creates a credential.
   *
   * @param attributes the attribute values to write
   * @throws NotSupportedByStoreException if the store has no updatable attributes
   */
  default void updateAttributes(final Map<String, String> attributes) {
    throw new NotSupportedByStoreException("No attributes can be updated");
  }

  /**
   * Deletes the underlying credential.
   *
   * @throws NoEntryException   if nothing matches
   * @throws AmbiguousException if more than one credential matches
   */
  void deleteCredential();

  /**
   * Resolves this credential to a wrapper of the credential it currently specifies.
   *
   * @return the wrapper, or empty if this object already is a wrapper
   * @throws NoEntryException   if nothing matches
   * @throws AmbiguousException if more than one credential matches
   */
  Optional<Credential> getCredential();

  /**
   * The service and user this credential was specified with, if the store keeps them.
   *
   * @return the specifiers
   */
  Optional<Specifiers> getSpecifiers();

  /**
   * Whether this credential is a specifier, resolved by its store on every call, rather
   * than a wrapper pinned to one stored credential.
   *
   * @return true for a specifier
   */
  boolean isSpecifier();

  /**
   * Typed access to the store-specific credential class, in place of a raw cast.
   *
   * @param type the expected concrete type
   * @param <T>  the expected concrete type
   * @return this credential, if it is of the given type
   */
  default <T> Optional<T> unwrap(final Class<T> type) {
    return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
  }
}
