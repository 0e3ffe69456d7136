//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto.bc;

import java.security.SecureRandom;
import java.util.Arrays;
import org.bouncycastle.crypto.CryptoException;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.StreamCipher;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.modes.SICBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.InvalidArgumentException;
import org.signal.protocolstore.crypto.CipherType;
import org.signal.protocolstore.crypto.CryptoProvider;
import org.signal.protocolstore.crypto.CryptographicMac;
import org.signal.protocolstore.logging.Log;

/**
 * A {@link CryptoProvider} built on the BouncyCastle lightweight API, independent of whatever
 * JCE providers the running JVM has installed.
 */
public class BouncyCastleCryptoProvider implements CryptoProvider {

  private static final String TAG = BouncyCastleCryptoProvider.class.getSimpleName();

  private final SecureRandom secureRandom;

  public BouncyCastleCryptoProvider() {
    this(new SecureRandom());
  }

  public BouncyCastleCryptoProvider(SecureRandom secureRandom) {
    this.secureRandom = secureRandom;
  }

  @Override
  public byte[] getRandomBytes(int length) throws CryptoFailureException {
    if (length < 0) {
      throw new IllegalArgumentException("negative length: " + length);
    }

    byte[] output = new byte[length];
    try {
      secureRandom.nextBytes(output);
    } catch (RuntimeException e) {
      Log.w(TAG, "random generator failed", e);
      throw new CryptoFailureException(e);
    }
    return output;
  }

  @Override
  public CryptographicMac hmacSha256(byte[] key) throws CryptoFailureException {
    try {
      HMac hmac = new HMac(new SHA256Digest());
      hmac.init(new KeyParameter(key));
      return new BouncyCastleCryptographicMac(hmac);
    } catch (IllegalArgumentException e) {
      Log.w(TAG, "cannot initialize HMAC", e);
      throw new CryptoFailureException(e);
    }
  }

  @Override
  public byte[] sha512Digest(byte[] data) throws CryptoFailureException {
    SHA512Digest digest = new SHA512Digest();
    byte[] output = new byte[digest.getDigestSize()];

    try {
      digest.update(data, 0, data.length);
      int length = digest.doFinal(output, 0);
      if (length != SHA512_DIGEST_LENGTH) {
        throw new CryptoFailureException("SHA-512 produced " + length + " bytes");
      }
      return output;
    } catch (DataLengthException e) {
      Log.w(TAG, "cannot compute digest", e);
      throw new CryptoFailureException(e);
    }
  }

  @Override
  public byte[] encrypt(CipherType cipher, byte[] key, byte[] iv, byte[] plaintext)
      throws InvalidArgumentException, CryptoFailureException {
    return process(true, cipher, key, iv, plaintext);
  }

  @Override
  public byte[] decrypt(CipherType cipher, byte[] key, byte[] iv, byte[] ciphertext)
      throws InvalidArgumentException, CryptoFailureException {
    return process(false, cipher, key, iv, ciphertext);
  }

  private byte[] process(
      boolean forEncryption, CipherType type, byte[] key, byte[] iv, byte[] input)
      throws InvalidArgumentException, CryptoFailureException {
    try {
      type.checkParameters(key, iv);
    } catch (InvalidArgumentException e) {
      Log.w(TAG, e.getMessage());
      throw e;
    }

    ParametersWithIV parameters = new ParametersWithIV(new KeyParameter(key), iv);
    byte[] output = new byte[type.maxOutputLength(input.length)];

    try {
      int outputLength;
      switch (type) {
        case AES_CBC_PKCS5:
          outputLength = processCbc(forEncryption, parameters, input, output);
          break;
        case AES_CTR_NOPADDING:
          outputLength = processCtr(forEncryption, parameters, input, output);
          break;
        default:
          throw new AssertionError(type);
      }
      return Arrays.copyOf(output, outputLength);
    } catch (CryptoException | DataLengthException | IllegalStateException e) {
      Log.w(TAG, (forEncryption ? "cannot encrypt" : "cannot decrypt") + " with " + type, e);
      throw new CryptoFailureException(e);
    }
  }

  private static int processCbc(
      boolean forEncryption, ParametersWithIV parameters, byte[] input, byte[] output)
      throws CryptoException {
    PaddedBufferedBlockCipher cipher =
        new PaddedBufferedBlockCipher(
            CBCBlockCipher.newInstance(AESEngine.newInstance()), new PKCS7Padding());
    cipher.init(forEncryption, parameters);

    int length = cipher.processBytes(input, 0, input.length, output, 0);
    return length + cipher.doFinal(output, length);
  }

  private static int processCtr(
      boolean forEncryption, ParametersWithIV parameters, byte[] input, byte[] output) {
    StreamCipher cipher = SICBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption, parameters);

    return cipher.processBytes(input, 0, input.length, output, 0);
  }
}
