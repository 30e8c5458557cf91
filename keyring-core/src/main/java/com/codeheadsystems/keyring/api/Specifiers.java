package com.codeheadsystems.keyring.api;

/**
 * The service name and user name that an entry was created with.
 *
 * @param service the service name
 * @param user    the user name
 */
public record Specifiers(String service, String user) {
}
