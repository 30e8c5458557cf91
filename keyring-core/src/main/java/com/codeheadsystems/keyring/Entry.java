package com.codeheadsystems.keyring;

import com.codeheadsystems.keyring.api.Credential;
import com.codeheadsystems.keyring.api.Specifiers;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client handle on a credential in a credential store.
 * <p>
 * An entry is created either as a <em>specifier</em> from a service name and user name
 * ({@link #create}), in which case the store decides on every call which credential is
 * meant, or as a <em>wrapper</em> around an existing credential ({@link #fromCredential},
 * {@link #searchForCredentials}, or the entries carried by an
 * {@link com.codeheadsystems.keyring.exceptions.AmbiguousException}).
 * <p>
 * Every method forwards to the underlying {@link Credential}; nothing is cached here.
 * Entries are immutable, so sharing one across threads shares the credential, not a copy.
 */
public final class Entry {

  private static final Logger log = LoggerFactory.getLogger(Entry.class);

  private final Credential inner;

  private Entry(final Credential inner) {
    this.inner = Objects.requireNonNull(inner, "credential");
  }

  /**
   * Creates an entry for the service and user in the default store.
   *
   * @param service the service name
   * @param user    the user name
   * @return the entry
   * @throws com.codeheadsystems.keyring.exceptions.NoDefaultStoreException if no default store is set
   */
  public static Entry create(final String service, final String user) {
    log.debug("create(service={}, user={})", service, user);
    Entry entry = DefaultStore.build(service, user, null);
    log.debug("created {}", entry);
    return entry;
  }

  /**
   * Creates an entry in the default store, passing store-specific modifiers.
   *
   * @param service   the service name
   * @param user      the user name
   * @param modifiers the modifiers, see the store's documentation
   * @return the entry
   */
  public static Entry createWithModifiers(final String service, final String user,
                                          final Map<String, String> modifiers) {
    log.debug("createWithModifiers(service={}, user={}, modifiers={})", service, user, modifiers);
    Entry entry = DefaultStore.build(service, user, modifiers);
    log.debug("created {}", entry);
    return entry;
  }

  /**
   * Creates an entry in the default store with a {@code target} modifier.
   *
   * @param target  the target
   * @param service the service name
   * @param user    the user name
   * @return the entry
   */
  public static Entry createWithTarget(final String target, final String service, final String user) {
    log.debug("createWithTarget(target={}, service={}, user={})", target, service, user);
    return DefaultStore.build(service, user, Map.of("target", target));
  }

  /**
   * Wraps an existing credential, bypassing the default store.
   *
   * @param credential the credential
   * @return the entry
   */
  public static Entry fromCredential(final Credential credential) {
    log.debug("fromCredential({})", credential);
    return new Entry(credential);
  }

  /**
   * Searches the default store.
   *
   * @param spec the store-specific search specification
   * @return one wrapper entry per match
   */
  public static List<Entry> searchForCredentials(final Map<String, String> spec) {
    log.debug("searchForCredentials({})", spec);
    return DefaultStore.withStore(store -> store.search(spec));
  }

  public void setPassword(final String password) {
    log.debug("setPassword({})", inner);
    inner.setPassword(password);
  }

  public void setSecret(final byte[] secret) {
    log.debug("setSecret({})", inner);
    inner.setSecret(secret);
  }

  public String getPassword() {
    log.debug("getPassword({})", inner);
    return inner.getPassword();
  }

  public byte[] getSecret() {
    log.debug("getSecret({})", inner);
    return inner.getSecret();
  }

  public Map<String, String> getAttributes() {
    log.debug("getAttributes({})", inner);
    return inner.getAttributes();
  }

  public void updateAttributes(final Map<String, String> attributes) {
    log.debug("updateAttributes({}, {})", inner, attributes.keySet());
    inner.updateAttributes(attributes);
  }

  public void deleteCredential() {
    log.debug("deleteCredential({})", inner);
    inner.deleteCredential();
  }

  /**
   * An entry wrapping the credential this entry currently resolves to.
   *
   * @return a wrapper entry, or this entry if it already is one
   */
  public Entry getCredential() {
    log.debug("getCredential({})", inner);
    return inner.getCredential().map(Entry::new).orElse(this);
  }

  /**
   * Whether this entry is a specifier. Among the entries of an ambiguity error, none is.
   *
   * @return true if the store resolves this entry on every call
   */
  public boolean isSpecifier() {
    boolean result = inner.isSpecifier();
    log.debug("isSpecifier({}) is {}", inner, result);
    return result;
  }

  public Optional<Specifiers> getSpecifiers() {
    return inner.getSpecifiers();
  }

  /**
   * Typed access to the store-specific credential behind this entry.
   *
   * @param type the credential class of the expected store
   * @param <T>  the credential class of the expected store
   * @return the credential, or empty if it belongs to a different kind of store
   */
  public <T> Optional<T> unwrap(final Class<T> type) {
    return inner.unwrap(type);
  }

  @Override
  public String toString() {
    return "Entry{" + inner + "}";
  }
}
