package com.codeheadsystems.keyring.sample;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.Objects;

/**
 * The stored state of one credential. Values are immutable; an update replaces the value in
 * its bucket.
 *
 * @param secret       the secret bytes
 * @param comment      free-form comment, may be null
 * @param creationTime when a forced credential was created, may be null; never changes once set
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CredentialValue(
    @JsonProperty("secret") byte[] secret,
    @JsonProperty("comment") String comment,
    @JsonProperty("creation_time") String creationTime) {

  public CredentialValue {
    secret = secret == null ? new byte[0] : secret.clone();
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  public CredentialValue withSecret(final byte[] newSecret) {
    return new CredentialValue(newSecret, comment, creationTime);
  }

  public CredentialValue withComment(final String newComment) {
    return new CredentialValue(secret, newComment, creationTime);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof CredentialValue other
        && Arrays.equals(secret, other.secret)
        && Objects.equals(comment, other.comment)
        && Objects.equals(creationTime, other.creationTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(secret), comment, creationTime);
  }

  // Never print the secret.
  @Override
  public String toString() {
    return "CredentialValue{secret=(" + secret.length + " bytes), comment=" + comment
        + ", creationTime=" + creationTime + "}";
  }
}
