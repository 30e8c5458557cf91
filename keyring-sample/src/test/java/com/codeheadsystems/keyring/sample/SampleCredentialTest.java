package com.codeheadsystems.keyring.sample;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keyring.DefaultStore;
import com.codeheadsystems.keyring.Entry;
import com.codeheadsystems.keyring.api.Specifiers;
import com.codeheadsystems.keyring.exceptions.InvalidException;
import com.codeheadsystems.keyring.exceptions.NoEntryException;
import java.security.SecureRandom;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Sample credential test.
 */
class SampleCredentialTest {

  private SampleStore store;
  private String name;

  @BeforeEach
  void setUp() {
    store = SampleStore.inMemory();
    DefaultStore.set(store);
    name = UUID.randomUUID().toString();
  }

  @AfterEach
  void tearDown() {
    DefaultStore.unset();
  }

  @Test
  void getPassword_missing_throwsNoEntry() {
    Entry entry = Entry.create(name, name);

    assertThatThrownBy(entry::getPassword).isInstanceOf(NoEntryException.class);
    assertThatThrownBy(entry::getAttributes).isInstanceOf(NoEntryException.class);
    assertThatThrownBy(entry::deleteCredential).isInstanceOf(NoEntryException.class);
  }

  @Test
  void specifiers_sameServiceAndUser_shareTheCredential() {
    Entry writer = Entry.create(name, name);
    Entry reader = Entry.create(name, name);

    writer.setPassword("shared password");

    assertThat(reader.getPassword()).isEqualTo("shared password");
    assertThat(store.credentialCount()).isEqualTo(1);
  }

  @Test
  void setPassword_existingCredential_updatesInPlace() {
    Entry entry = Entry.create(name, name);
    entry.setPassword("first");
    String uuid = entry.getAttributes().get(SampleCredential.UUID_ATTRIBUTE);

    entry.setPassword("second");

    assertThat(entry.getPassword()).isEqualTo("second");
    assertThat(entry.getAttributes()).containsEntry(SampleCredential.UUID_ATTRIBUTE, uuid);
    assertThat(store.credentialCount()).isEqualTo(1);
  }

  @Test
  void password_unicode_roundTrip() {
    Entry entry = Entry.create(name, "");

    entry.setPassword("このきれいな花は桜です");

    assertThat(entry.getPassword()).isEqualTo("このきれいな花は桜です");
  }

  @Test
  void secret_arbitraryBytes_roundTrip() {
    byte[] random = new byte[32];
    new SecureRandom().nextBytes(random);
    byte[] notUtf8 = {(byte) 0xff, 0x00, (byte) 0x80};
    Entry entry = Entry.create(name, name);

    entry.setSecret(random);
    assertThat(entry.getSecret()).isEqualTo(random);
    entry.setSecret(notUtf8);
    assertThat(entry.getSecret()).isEqualTo(notUtf8);
    entry.setSecret(new byte[0]);
    assertThat(entry.getSecret()).isEmpty();
  }

  @Test
  void setSecret_callerMutatesArrayAfterwards_storedSecretUnchanged() {
    byte[] secret = {1, 2, 3};
    Entry entry = Entry.create(name, name);

    entry.setSecret(secret);
    secret[0] = 9;
    entry.getSecret()[1] = 9;

    assertThat(entry.getSecret()).containsExactly(1, 2, 3);
  }

  @Test
  void deleteCredential_twice_secondThrowsNoEntry() {
    Entry entry = Entry.create(name, name);
    entry.setPassword("to delete");

    entry.deleteCredential();

    assertThatThrownBy(entry::deleteCredential).isInstanceOf(NoEntryException.class);
    assertThat(store.credentialCount()).isZero();
  }

  @Test
  void wrapper_afterDelete_neverRetargets() {
    Entry specifier = Entry.create(name, name);
    specifier.setPassword("original");
    Entry wrapper = specifier.getCredential();

    wrapper.deleteCredential();
    specifier.setPassword("replacement");

    assertThatThrownBy(wrapper::getPassword).isInstanceOf(NoEntryException.class);
    assertThatThrownBy(() -> wrapper.setPassword("nope")).isInstanceOf(NoEntryException.class);
    assertThatThrownBy(wrapper::deleteCredential).isInstanceOf(NoEntryException.class);
    assertThat(specifier.getPassword()).isEqualTo("replacement");
  }

  @Test
  void getCredential_specifier_returnsPinnedWrapper() {
    Entry specifier = Entry.create(name, name);
    assertThatThrownBy(specifier::getCredential).isInstanceOf(NoEntryException.class);
    specifier.setPassword("password");

    Entry wrapper = specifier.getCredential();

    assertThat(specifier.isSpecifier()).isTrue();
    assertThat(wrapper.isSpecifier()).isFalse();
    SampleCredential pinned = wrapper.unwrap(SampleCredential.class).orElseThrow();
    assertThat(pinned.isSpecifier()).isFalse();
    assertThat(pinned.getUuid()).isEqualTo(specifier.getAttributes().get(SampleCredential.UUID_ATTRIBUTE));
    assertThat(wrapper.getCredential()).isSameAs(wrapper);
    assertThat(wrapper.getPassword()).isEqualTo("password");
  }

  @Test
  void getAttributes_plainCredential_hasOnlyUuid() {
    Entry entry = Entry.create(name, name);
    entry.setPassword("password");

    Map<String, String> attributes = entry.getAttributes();

    assertThat(attributes).containsOnlyKeys(SampleCredential.UUID_ATTRIBUTE);
    assertThat(UUID.fromString(attributes.get(SampleCredential.UUID_ATTRIBUTE))).isNotNull();
  }

  @Test
  void updateAttributes_comment_isStored() {
    Entry entry = Entry.create(name, name);
    entry.setPassword("password");

    entry.updateAttributes(Map.of(SampleCredential.COMMENT_ATTRIBUTE, "work laptop"));

    assertThat(entry.getAttributes()).containsEntry(SampleCredential.COMMENT_ATTRIBUTE, "work laptop");
    assertThat(entry.unwrap(SampleCredential.class).orElseThrow().getComment()).contains("work laptop");
    assertThat(entry.getPassword()).isEqualTo("password");
  }

  @Test
  void updateAttributes_readOnlyKeys_throwInvalidAndChangeNothing() {
    Entry entry = Entry.create(name, name);
    entry.setPassword("password");
    Map<String, String> before = entry.getAttributes();

    assertThatThrownBy(() -> entry.updateAttributes(Map.of(SampleCredential.UUID_ATTRIBUTE, "other")))
        .isInstanceOfSatisfying(InvalidException.class,
            e -> assertThat(e.attribute()).isEqualTo(SampleCredential.UUID_ATTRIBUTE));
    assertThatThrownBy(() -> entry.updateAttributes(Map.of(SampleCredential.CREATION_TIME_ATTRIBUTE, "now")))
        .isInstanceOfSatisfying(InvalidException.class,
            e -> assertThat(e.attribute()).isEqualTo(SampleCredential.CREATION_TIME_ATTRIBUTE));
    assertThatThrownBy(() -> entry.updateAttributes(Map.of(
        SampleCredential.COMMENT_ATTRIBUTE, "sneaky",
        SampleCredential.UUID_ATTRIBUTE, "other")))
        .isInstanceOf(InvalidException.class);

    assertThat(entry.getAttributes()).isEqualTo(before);
  }

  @Test
  void updateAttributes_unknownKey_isIgnored() {
    Entry entry = Entry.create(name, name);
    entry.setPassword("password");
    Map<String, String> before = entry.getAttributes();

    assertThatCode(() -> entry.updateAttributes(Map.of("colour", "red"))).doesNotThrowAnyException();

    assertThat(entry.getAttributes()).isEqualTo(before);
  }

  @Test
  void updateAttributes_missing_throwsNoEntryAndDoesNotCreate() {
    Entry entry = Entry.create(name, name);

    assertThatThrownBy(() -> entry.updateAttributes(Map.of(SampleCredential.COMMENT_ATTRIBUTE, "x")))
        .isInstanceOf(NoEntryException.class);

    assertThat(store.credentialCount()).isZero();
  }

  @Test
  void getSpecifiers_returnsServiceAndUser() {
    Entry entry = Entry.create("service", "user");

    assertThat(entry.getSpecifiers()).contains(new Specifiers("service", "user"));
  }

  @Test
  void equals_wrappersForSameCredential_areEqual() {
    Entry entry = Entry.create(name, name);
    entry.setPassword("password");

    SampleCredential first = entry.getCredential().unwrap(SampleCredential.class).orElseThrow();
    SampleCredential second = entry.getCredential().unwrap(SampleCredential.class).orElseThrow();

    assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    assertThat(first).isNotEqualTo(entry.unwrap(SampleCredential.class).orElseThrow());
    assertThat(first.toString()).contains(store.id()).contains(first.getUuid());
  }

  @Test
  void credential_fromOtherStore_isIndependent() {
    SampleStore other = SampleStore.inMemory();
    Entry here = Entry.create(name, name);
    Entry there = other.build(name, name, null);

    here.setPassword("here");

    assertThatThrownBy(there::getPassword).isInstanceOf(NoEntryException.class);
    assertThat(other.credentialCount()).isZero();
  }
}
