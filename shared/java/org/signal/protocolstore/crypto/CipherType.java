//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto;

import org.signal.protocolstore.InvalidArgumentException;

/** The AES modes a {@link CryptoProvider} must support. The key length selects AES-128/192/256. */
public enum CipherType {
  AES_CBC_PKCS5(1),
  AES_CTR_NOPADDING(2);

  public static final int BLOCK_SIZE = 16;
  public static final int IV_LENGTH = BLOCK_SIZE;

  private final int id;

  CipherType(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  /** Worst-case output length for {@code inputLength} bytes of input, one block of slack. */
  public int maxOutputLength(int inputLength) {
    return inputLength + BLOCK_SIZE;
  }

  /**
   * Rejects parameters no AES implementation can accept.
   *
   * @throws InvalidArgumentException if the key is not 16, 24 or 32 bytes long or the IV is not
   *     exactly one block.
   */
  public void checkParameters(byte[] key, byte[] iv) throws InvalidArgumentException {
    if (key == null || !isSupportedKeyLength(key.length)) {
      throw new InvalidArgumentException(
          "invalid AES mode or key size: " + this + "/" + (key == null ? null : key.length));
    }

    if (iv == null || iv.length != IV_LENGTH) {
      throw new InvalidArgumentException(
          "invalid AES IV size: " + (iv == null ? null : iv.length));
    }
  }

  public static boolean isSupportedKeyLength(int keyLength) {
    return keyLength == 16 || keyLength == 24 || keyLength == 32;
  }

  public static CipherType forId(int id) throws InvalidArgumentException {
    for (CipherType type : values()) {
      if (type.id == id) {
        return type;
      }
    }
    throw new InvalidArgumentException("unknown cipher: " + id);
  }
}
