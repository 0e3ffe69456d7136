//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore;

import java.util.Objects;
import org.bouncycastle.math.ec.rfc7748.X25519;
import org.signal.protocolstore.crypto.CryptoProvider;
import org.signal.protocolstore.util.ByteUtil;

/** Holder for public and private identity key pair. */
public class IdentityKeyPair {

  /** Type prefix the engine expects on serialized Curve25519 public keys. */
  public static final byte DJB_TYPE = 0x05;

  public static final int PRIVATE_KEY_LENGTH = X25519.SCALAR_SIZE;

  private final IdentityKey publicKey;
  private final byte[] privateKey;

  public IdentityKeyPair(IdentityKey publicKey, byte[] privateKey) {
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
    this.privateKey = Objects.requireNonNull(privateKey, "privateKey").clone();
  }

  /**
   * Generate a fresh Curve25519 identity key pair from the provider's random source.
   *
   * @throws CryptoFailureException if the provider cannot produce random bytes.
   */
  public static IdentityKeyPair generate(CryptoProvider cryptoProvider)
      throws CryptoFailureException {
    byte[] privateKey = cryptoProvider.getRandomBytes(PRIVATE_KEY_LENGTH);
    if (privateKey.length != PRIVATE_KEY_LENGTH) {
      throw new CryptoFailureException("random generator returned " + privateKey.length + " bytes");
    }

    privateKey[0] &= (byte) 248;
    privateKey[31] &= (byte) 127;
    privateKey[31] |= (byte) 64;

    byte[] publicKey = new byte[X25519.POINT_SIZE];
    X25519.generatePublicKey(privateKey, 0, publicKey, 0);

    return new IdentityKeyPair(
        new IdentityKey(ByteUtil.combine(new byte[] {DJB_TYPE}, publicKey)), privateKey);
  }

  public IdentityKey getPublicKey() {
    return publicKey;
  }

  public byte[] getPrivateKey() {
    return privateKey.clone();
  }
}
