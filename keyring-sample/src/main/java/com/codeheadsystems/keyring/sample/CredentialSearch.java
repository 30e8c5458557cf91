package com.codeheadsystems.keyring.sample;

import com.codeheadsystems.keyring.exceptions.InvalidException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled search specification for the sample store.
 * <p>
 * Recognized keys are {@code service}, {@code user}, {@code uuid} and {@code comment}. Each
 * value is a {@link Pattern} that must be found somewhere in the field (use {@code ^...$}
 * to anchor). A credential matches when every supplied pattern matches; a key that is not
 * supplied places no constraint on its field. A {@code comment} pattern never matches a
 * credential that has no comment.
 */
public final class CredentialSearch {

  public static final String SERVICE = "service";
  public static final String USER = "user";
  public static final String UUID = "uuid";
  public static final String COMMENT = "comment";

  private static final Set<String> KEYS = Set.of(SERVICE, USER, UUID, COMMENT);

  private final Map<String, Pattern> patterns;

  private CredentialSearch(final Map<String, Pattern> patterns) {
    this.patterns = patterns;
  }

  /**
   * Compiles a search specification.
   *
   * @param spec key to regular expression
   * @return the compiled search
   * @throws InvalidException naming an unknown key or a key whose pattern does not compile
   */
  public static CredentialSearch compile(final Map<String, String> spec) {
    Map<String, Pattern> patterns = new HashMap<>();
    for (Map.Entry<String, String> entry : spec.entrySet()) {
      if (!KEYS.contains(entry.getKey())) {
        throw new InvalidException(entry.getKey(), "unknown key");
      }
      try {
        patterns.put(entry.getKey(), Pattern.compile(entry.getValue()));
      } catch (PatternSyntaxException e) {
        throw new InvalidException(entry.getKey(), e.getDescription(), e);
      }
    }
    return new CredentialSearch(patterns);
  }

  /**
   * Whether one stored credential satisfies every pattern.
   *
   * @param id    the credential's bucket id
   * @param uuid  the credential's uuid
   * @param value the credential's value
   * @return true on a match
   */
  public boolean matches(final CredentialId id, final String uuid, final CredentialValue value) {
    return fieldMatches(SERVICE, id.service())
        && fieldMatches(USER, id.user())
        && fieldMatches(UUID, uuid)
        && fieldMatches(COMMENT, value.comment());
  }

  private boolean fieldMatches(final String key, final String field) {
    Pattern pattern = patterns.get(key);
    if (pattern == null) {
      return true;
    }
    return field != null && pattern.matcher(field).find();
  }
}
