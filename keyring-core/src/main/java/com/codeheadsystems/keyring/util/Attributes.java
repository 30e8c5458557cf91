package com.codeheadsystems.keyring.util;

import com.codeheadsystems.keyring.exceptions.InvalidException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validation of modifier and attribute maps against a store's allow-list.
 */
public class Attributes {

  private static final String BOOLEAN_PREFIX = "*";

  private Attributes() {
  }

  /**
   * Checks every key of {@code attributes} against {@code allowedKeys}.
   * <p>
   * An allowed key written with a leading {@code *} (e.g. {@code "*synchronizable"}) must
   * carry the value {@code true} or {@code false}; the {@code *} is not part of the key.
   *
   * @param allowedKeys the keys the store accepts
   * @param attributes  the caller's map, may be null
   * @return a copy of the accepted entries, empty when {@code attributes} is null
   * @throws InvalidException naming the first unknown key or non-boolean flag
   */
  public static Map<String, String> parse(final Set<String> allowedKeys,
                                          final Map<String, String> attributes) {
    Map<String, String> result = new HashMap<>();
    if (attributes == null) {
      return result;
    }
    Map<String, Boolean> keyIsBoolean = new HashMap<>();
    for (String key : allowedKeys) {
      if (key.startsWith(BOOLEAN_PREFIX)) {
        keyIsBoolean.put(key.substring(BOOLEAN_PREFIX.length()), true);
      } else {
        keyIsBoolean.put(key, false);
      }
    }
    for (Map.Entry<String, String> entry : attributes.entrySet()) {
      Boolean isBoolean = keyIsBoolean.get(entry.getKey());
      if (isBoolean == null) {
        throw new InvalidException(entry.getKey(), "unknown key");
      }
      if (isBoolean && !"true".equals(entry.getValue()) && !"false".equals(entry.getValue())) {
        throw new InvalidException(entry.getKey(), "must be `true` or `false`");
      }
      result.put(entry.getKey(), entry.getValue());
    }
    return result;
  }
}
