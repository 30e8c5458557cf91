package com.codeheadsystems.keyring.util;

import com.codeheadsystems.keyring.exceptions.BadEncodingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Conversions between secrets and passwords.
 */
public class Secrets {

  private Secrets() {
  }

  /**
   * Strictly decodes a secret as UTF-8. Malformed input is reported rather than replaced.
   *
   * @param secret the secret bytes
   * @return the password
   * @throws BadEncodingException carrying the original bytes if they are not UTF-8
   */
  public static String decodePassword(final byte[] secret) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(secret))
          .toString();
    } catch (CharacterCodingException e) {
      throw new BadEncodingException(secret);
    }
  }
}
