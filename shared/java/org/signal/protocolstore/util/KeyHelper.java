//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.util;

import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.crypto.CryptoProvider;

/** Helper class for generating local identity values. */
public class KeyHelper {

  private KeyHelper() {}

  /**
   * Generate a registration ID. Clients should only do this once, at install time.
   *
   * @param cryptoProvider the source of randomness.
   * @param extendedRange By default (false), the generated registration ID is sized to require the
   *     minimal possible protobuf encoding overhead. Specify true if the caller needs the full
   *     range of MAX_INT at the cost of slightly higher encoding overhead.
   * @return the generated registration ID, never zero.
   */
  public static int generateRegistrationId(CryptoProvider cryptoProvider, boolean extendedRange)
      throws CryptoFailureException {
    byte[] randomBytes = cryptoProvider.getRandomBytes(4);
    if (randomBytes.length != 4) {
      throw new CryptoFailureException(
          "random generator returned " + randomBytes.length + " bytes");
    }

    int random = ByteUtil.byteArray4ToInt(randomBytes, 0) & Integer.MAX_VALUE;
    if (extendedRange) return (random % (Integer.MAX_VALUE - 1)) + 1;
    else return (random % 16380) + 1;
  }
}
