package com.codeheadsystems.keyring.mock;

import com.codeheadsystems.keyring.Entry;
import com.codeheadsystems.keyring.api.CredentialPersistence;
import com.codeheadsystems.keyring.api.CredentialStore;
import java.util.Map;

/**
 * A store for testing client code without touching any real storage.
 * <p>
 * Every entry gets its own fresh {@link MockCredential}, so two entries built for the same
 * service and user do not see each other's secrets, and nothing outlives the entry.
 * Modifiers are ignored. To inject failures, unwrap the entry's credential:
 * <pre>
 *   Entry entry = Entry.create("service", "user");
 *   entry.unwrap(MockCredential.class).orElseThrow()
 *       .setError(new InvalidException("mock error", "takes precedence"));
 * </pre>
 */
public class MockStore implements CredentialStore {

  @Override
  public String vendor() {
    return "mock";
  }

  @Override
  public String id() {
    return "mock";
  }

  @Override
  public Entry build(final String service, final String user, final Map<String, String> modifiers) {
    return Entry.fromCredential(new MockCredential(service, user));
  }

  @Override
  public CredentialPersistence persistence() {
    return CredentialPersistence.ENTRY_ONLY;
  }

  @Override
  public String toString() {
    return "MockStore";
  }
}
