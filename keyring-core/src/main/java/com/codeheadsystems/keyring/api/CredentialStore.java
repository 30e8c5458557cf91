package com.codeheadsystems.keyring.api;

import com.codeheadsystems.keyring.Entry;
import com.codeheadsystems.keyring.exceptions.InvalidException;
import com.codeheadsystems.keyring.exceptions.NotSupportedByStoreException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store-level operations of a credential store.
 * <p>
 * Implementations must be thread-safe. A store that cannot search must throw
 * {@link NotSupportedByStoreException} rather than return an empty result.
 */
public interface CredentialStore {

  /**
   * Identifies the implementation, e.g. {@code "keyring-core-sample"}.
   *
   * @return the vendor
   */
  String vendor();

  /**
   * Identifies this store instance among stores of the same vendor.
   *
   * @return the id
   */
  String id();

  /**
   * Builds an entry for the given service and user.
   *
   * @param service   the service name
   * @param user      the user name
   * @param modifiers store-specific modifiers, or null for none
   * @return the new entry
   * @throws InvalidException if a parameter or modifier is not acceptable to this store
   */
  Entry build(String service, String user, Map<String, String> modifiers);

  /**
   * Finds existing credentials matching a store-specific specification.
   *
   * @param spec the search specification
   * @return one wrapper entry per matching credential
   */
  default List<Entry> search(final Map<String, String> spec) {
    throw new NotSupportedByStoreException(vendor());
  }

  /**
   * How long credentials in this store last.
   *
   * @return the persistence class
   */
  default CredentialPersistence persistence() {
    return CredentialPersistence.UNTIL_DELETE;
  }

  /**
   * Typed access to the concrete store class, in place of a raw cast.
   *
   * @param type the expected concrete type
   * @param <T>  the expected concrete type
   * @return this store, if it is of the given type
   */
  default <T> Optional<T> unwrap(final Class<T> type) {
    return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
  }
}
