package com.codeheadsystems.keyring.mock;

import com.codeheadsystems.keyring.api.Credential;
import com.codeheadsystems.keyring.api.Specifiers;
import com.codeheadsystems.keyring.exceptions.KeyringException;
import com.codeheadsystems.keyring.exceptions.NoEntryException;
import java.util.Map;
import java.util.Optional;

/**
 * A credential that keeps its secret in itself and can be told to fail.
 * <p>
 * {@link #setError} arms a one-shot failure: the next operation throws it, and the
 * operation after that behaves normally again. Credentials have no attributes; attribute
 * updates are accepted and ignored once a secret exists.
 */
public class MockCredential implements Credential {

  private final String service;
  private final String user;

  // Guarded by this.
  private byte[] secret;
  private KeyringException error;

  /**
   * Instantiates a new Mock credential.
   *
   * @param service the service name
   * @param user    the user name
   */
  public MockCredential(final String service, final String user) {
    this.service = service;
    this.user = user;
  }

  /**
   * Makes the next operation on this credential throw the given exception.
   *
   * @param error the exception to throw once
   */
  public synchronized void setError(final KeyringException error) {
    this.error = error;
  }

  @Override
  public synchronized void setSecret(final byte[] secret) {
    throwPendingError();
    this.secret = secret.clone();
  }

  @Override
  public synchronized byte[] getSecret() {
    throwPendingError();
    if (secret == null) {
      throw new NoEntryException();
    }
    return secret.clone();
  }

  @Override
  public synchronized void updateAttributes(final Map<String, String> attributes) {
    throwPendingError();
    if (secret == null) {
      throw new NoEntryException();
    }
  }

  @Override
  public synchronized void deleteCredential() {
    throwPendingError();
    if (secret == null) {
      throw new NoEntryException();
    }
    secret = null;
  }

  // Every mock credential is a specifier, though it never resolves to anything else.
  @Override
  public boolean isSpecifier() {
    return true;
  }

  @Override
  public Optional<Credential> getCredential() {
    return Optional.empty();
  }

  @Override
  public Optional<Specifiers> getSpecifiers() {
    return Optional.of(new Specifiers(service, user));
  }

  private void throwPendingError() {
    KeyringException pending = error;
    if (pending != null) {
      error = null;
      throw pending;
    }
  }

  @Override
  public String toString() {
    return "MockCredential{service=" + service + ", user=" + user + "}";
  }
}
