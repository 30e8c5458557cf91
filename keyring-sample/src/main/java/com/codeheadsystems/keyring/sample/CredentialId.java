package com.codeheadsystems.keyring.sample;

/**
 * The service and user that a bucket of credentials is filed under.
 *
 * @param service the service name
 * @param user    the user name
 */
public record CredentialId(String service, String user) {
}
