//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto;

import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.InvalidArgumentException;

/**
 * The cryptographic primitives the protocol engine calls into without choosing an
 * implementation itself.
 *
 * <p>Implementations must produce standard, bit-exact output: two providers given the same inputs
 * return the same bytes. Parameter problems are reported as {@link InvalidArgumentException}
 * before any primitive runs; failures inside the primitive are reported as {@link
 * CryptoFailureException}.
 */
public interface CryptoProvider {

  public static final int SHA256_MAC_LENGTH = 32;
  public static final int SHA512_DIGEST_LENGTH = 64;

  /**
   * @param length the number of bytes wanted; must not be negative.
   * @return exactly {@code length} cryptographically secure random bytes.
   * @throws CryptoFailureException if the random generator fails.
   */
  public byte[] getRandomBytes(int length) throws CryptoFailureException;

  /**
   * Start a streaming HMAC-SHA256 computation.
   *
   * @param key the MAC key; may be empty.
   * @throws CryptoFailureException if the primitive cannot be initialized.
   */
  public CryptographicMac hmacSha256(byte[] key) throws CryptoFailureException;

  /**
   * @return the 64 byte SHA-512 digest of {@code data}.
   * @throws CryptoFailureException if the underlying primitive fails.
   */
  public byte[] sha512Digest(byte[] data) throws CryptoFailureException;

  /**
   * Encrypt {@code plaintext} with AES in the given mode.
   *
   * <p>{@link CipherType#AES_CBC_PKCS5} pads the output to a whole number of blocks; {@link
   * CipherType#AES_CTR_NOPADDING} returns exactly {@code plaintext.length} bytes.
   *
   * @throws InvalidArgumentException if the key length is unsupported or the IV is not 16 bytes.
   * @throws CryptoFailureException if the cipher fails.
   */
  public byte[] encrypt(CipherType cipher, byte[] key, byte[] iv, byte[] plaintext)
      throws InvalidArgumentException, CryptoFailureException;

  /**
   * Decrypt {@code ciphertext} with AES in the given mode. CBC padding is validated and removed.
   *
   * @throws InvalidArgumentException if the key length is unsupported or the IV is not 16 bytes.
   * @throws CryptoFailureException if the cipher fails, including on invalid padding.
   */
  public byte[] decrypt(CipherType cipher, byte[] key, byte[] iv, byte[] ciphertext)
      throws InvalidArgumentException, CryptoFailureException;
}
