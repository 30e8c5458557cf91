package com.codeheadsystems.keyring;

import com.codeheadsystems.keyring.api.CredentialStore;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates entries in one explicitly supplied store, for code that injects its store
 * instead of relying on {@link DefaultStore}.
 */
@Singleton
public class EntryFactory {

  private static final Logger log = LoggerFactory.getLogger(EntryFactory.class);

  private final CredentialStore store;

  @Inject
  public EntryFactory(final CredentialStore store) {
    log.info("EntryFactory({})", store.id());
    this.store = store;
  }

  public Entry create(final String service, final String user) {
    log.debug("create(service={}, user={})", service, user);
    return store.build(service, user, null);
  }

  public Entry createWithModifiers(final String service, final String user,
                                   final Map<String, String> modifiers) {
    log.debug("createWithModifiers(service={}, user={}, modifiers={})", service, user, modifiers);
    return store.build(service, user, modifiers);
  }

  public List<Entry> search(final Map<String, String> spec) {
    log.debug("search({})", spec);
    return store.search(spec);
  }

  public CredentialStore store() {
    return store;
  }
}
