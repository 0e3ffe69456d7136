//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto.jce;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.InvalidArgumentException;
import org.signal.protocolstore.crypto.CipherType;
import org.signal.protocolstore.crypto.CryptoProvider;
import org.signal.protocolstore.crypto.CryptographicMac;
import org.signal.protocolstore.logging.Log;

/** A {@link CryptoProvider} backed by the JDK's installed JCA/JCE providers. */
public class JceCryptoProvider implements CryptoProvider {

  private static final String TAG = JceCryptoProvider.class.getSimpleName();

  private static final String HMAC_SHA256 = "HmacSHA256";

  private final SecureRandom secureRandom;

  public JceCryptoProvider() {
    this(new SecureRandom());
  }

  public JceCryptoProvider(SecureRandom secureRandom) {
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
    // HMAC zero-pads short keys to the block size, so an empty key equals a single zero byte.
    byte[] macKey = key.length == 0 ? new byte[1] : key;

    try {
      Mac mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(macKey, HMAC_SHA256));
      return new JceCryptographicMac(mac);
    } catch (GeneralSecurityException e) {
      Log.w(TAG, "cannot initialize HMAC", e);
      throw new CryptoFailureException(e);
    }
  }

  @Override
  public byte[] sha512Digest(byte[] data) throws CryptoFailureException {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-512").digest(data);
      if (digest.length != SHA512_DIGEST_LENGTH) {
        throw new CryptoFailureException("SHA-512 produced " + digest.length + " bytes");
      }
      return digest;
    } catch (GeneralSecurityException e) {
      Log.w(TAG, "cannot compute digest", e);
      throw new CryptoFailureException(e);
    }
  }

  @Override
  public byte[] encrypt(CipherType cipher, byte[] key, byte[] iv, byte[] plaintext)
      throws InvalidArgumentException, CryptoFailureException {
    return process(Cipher.ENCRYPT_MODE, cipher, key, iv, plaintext);
  }

  @Override
  public byte[] decrypt(CipherType cipher, byte[] key, byte[] iv, byte[] ciphertext)
      throws InvalidArgumentException, CryptoFailureException {
    return process(Cipher.DECRYPT_MODE, cipher, key, iv, ciphertext);
  }

  private byte[] process(int mode, CipherType type, byte[] key, byte[] iv, byte[] input)
      throws InvalidArgumentException, CryptoFailureException {
    try {
      type.checkParameters(key, iv);
    } catch (InvalidArgumentException e) {
      Log.w(TAG, e.getMessage());
      throw e;
    }

    try {
      Cipher cipher = Cipher.getInstance(transformationFor(type));
      cipher.init(mode, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));

      byte[] output = new byte[type.maxOutputLength(input.length)];
      int outputLength = cipher.doFinal(input, 0, input.length, output, 0);

      return Arrays.copyOf(output, outputLength);
    } catch (GeneralSecurityException e) {
      String operation = mode == Cipher.ENCRYPT_MODE ? "encrypt" : "decrypt";
      Log.w(TAG, "cannot " + operation + " with " + type, e);
      throw new CryptoFailureException(e);
    }
  }

  private static String transformationFor(CipherType type) {
    switch (type) {
      case AES_CBC_PKCS5:
        return "AES/CBC/PKCS5Padding";
      case AES_CTR_NOPADDING:
        return "AES/CTR/NoPadding";
      default:
        throw new AssertionError(type);
    }
  }
}
