package com.codeheadsystems.keyring.mock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keyring.Entry;
import com.codeheadsystems.keyring.api.CredentialPersistence;
import com.codeheadsystems.keyring.exceptions.InvalidException;
import com.codeheadsystems.keyring.exceptions.NoEntryException;
import com.codeheadsystems.keyring.exceptions.TooLongException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MockCredentialTest {

  private MockStore store;

  @BeforeEach
  void setUp() {
    store = new MockStore();
  }

  @Test
  void persistence_isEntryOnly() {
    assertThat(store.persistence()).isEqualTo(CredentialPersistence.ENTRY_ONLY);
    assertThat(store.vendor()).isEqualTo("mock");
    assertThat(store.id()).isEqualTo("mock");
  }

  @Test
  void build_sameServiceAndUser_doesNotShareSecrets() {
    Entry first = store.build("svc", "usr", null);
    Entry second = store.build("svc", "usr", null);

    first.setPassword("only in first");

    assertThatThrownBy(second::getPassword).isInstanceOf(NoEntryException.class);
  }

  @Test
  void setError_failsOnceThenClears() {
    Entry entry = store.build("svc", "usr", null);
    MockCredential mock = entry.unwrap(MockCredential.class).orElseThrow();

    mock.setError(new InvalidException("mock error", "is an error"));
    assertThatThrownBy(() -> entry.setPassword("password")).isInstanceOf(InvalidException.class);
    entry.setPassword("password");

    mock.setError(new NoEntryException());
    assertThatThrownBy(entry::getPassword).isInstanceOf(NoEntryException.class);
    assertThat(entry.getPassword()).isEqualTo("password");

    mock.setError(new TooLongException("mock", 3));
    assertThatThrownBy(entry::deleteCredential)
        .isInstanceOfSatisfying(TooLongException.class, e -> assertThat(e.limit()).isEqualTo(3));
    entry.deleteCredential();
    assertThatThrownBy(entry::getPassword).isInstanceOf(NoEntryException.class);
  }

  @Test
  void updateAttributes_missingCredential_throwsNoEntry_thenIgnoredOnceCreated() {
    Entry entry = store.build("svc", "usr", null);
    Map<String, String> update = Map.of("test attribute name", "test attribute value");

    assertThatThrownBy(() -> entry.updateAttributes(update)).isInstanceOf(NoEntryException.class);

    entry.setPassword("test password for attributes");
    assertThatCode(() -> entry.updateAttributes(update)).doesNotThrowAnyException();
    assertThat(entry.getAttributes()).isEmpty();
  }

  @Test
  void deleteCredential_missing_throwsNoEntry() {
    Entry entry = store.build("svc", "usr", null);

    assertThatThrownBy(entry::deleteCredential).isInstanceOf(NoEntryException.class);
  }
}
