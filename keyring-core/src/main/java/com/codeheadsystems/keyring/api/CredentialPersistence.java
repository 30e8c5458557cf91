package com.codeheadsystems.keyring.api;

/**
 * How long the credentials of a store outlive the process that created them.
 */
public enum CredentialPersistence {
  /**
   * Kept only in the entry object; gone when the entry is.
   */
  ENTRY_ONLY,
  /**
   * Kept in process memory; gone when the process exits.
   */
  PROCESS_ONLY,
  /**
   * Gone when the user logs out.
   */
  UNTIL_LOGOUT,
  /**
   * Gone when the machine reboots.
   */
  UNTIL_REBOOT,
  /**
   * Kept until explicitly deleted.
   */
  UNTIL_DELETE,
  /**
   * The store does not say.
   */
  UNSPECIFIED
}
