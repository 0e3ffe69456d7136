//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto;

import org.signal.protocolstore.CryptoFailureException;

/**
 * A keyed, streaming MAC computation obtained from {@link CryptoProvider#hmacSha256(byte[])}.
 *
 * <p>Data may be supplied in any number of {@link #update} calls. {@link #finish()} returns the
 * MAC and resets the computation with the same key. Instances hold library state and must be
 * closed; use them in a try-with-resources block. Every method other than {@link #close()} throws
 * {@link IllegalStateException} once the instance is closed.
 */
public interface CryptographicMac extends AutoCloseable {

  public void update(byte[] input, int offset, int len);

  default void update(byte[] input) {
    update(input, 0, input.length);
  }

  /**
   * @return the MAC over everything supplied since the last reset, always {@link
   *     #getMacLength()} bytes.
   * @throws CryptoFailureException if the underlying primitive fails.
   */
  public byte[] finish() throws CryptoFailureException;

  public int getMacLength();

  /** Releases the underlying state. Idempotent. */
  @Override
  public void close();
}
