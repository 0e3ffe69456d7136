//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.util;

/** Utility for bytes to hex. */
public final class Hex {

  private static final char[] HEX_DIGITS = {
    '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
  };

  private Hex() {}

  public static String toStringCondensed(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte aByte : bytes) {
      appendHexChar(builder, aByte);
    }
    return builder.toString();
  }

  private static void appendHexChar(StringBuilder buf, int b) {
    buf.append(HEX_DIGITS[(b >> 4) & 0xf]);
    buf.append(HEX_DIGITS[b & 0xf]);
  }
}
