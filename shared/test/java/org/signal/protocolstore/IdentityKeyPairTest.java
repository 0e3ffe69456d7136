//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.bouncycastle.util.encoders.Hex;
import org.junit.Test;
import org.signal.protocolstore.crypto.CryptoProvider;

public class IdentityKeyPairTest {

  @Test
  public void testGenerateDerivesPublicKey() throws Exception {
    // RFC 7748, section 6.1
    byte[] alicePrivate =
        Hex.decode("77076d0a7318a57d3c16c17251b26645df4c2f87ebc0992ab177fba51db92c2a");
    CryptoProvider provider = mock(CryptoProvider.class);
    when(provider.getRandomBytes(32)).thenReturn(alicePrivate.clone());

    IdentityKeyPair keyPair = IdentityKeyPair.generate(provider);

    assertEquals(
        "05" + "8520f0098930a754748b7ddcb43ef75a0dbf3a0d26381af4eba4a98eaa9b4e6a",
        keyPair.getPublicKey().getFingerprint());

    byte[] privateKey = keyPair.getPrivateKey();
    assertEquals(32, privateKey.length);
    assertEquals((byte) 0x70, privateKey[0]);
    assertEquals((byte) 0x6a, privateKey[31]);
  }

  @Test(expected = CryptoFailureException.class)
  public void testShortRandomOutputIsAFailure() throws Exception {
    CryptoProvider provider = mock(CryptoProvider.class);
    when(provider.getRandomBytes(32)).thenReturn(new byte[31]);

    IdentityKeyPair.generate(provider);
  }

  @Test
  public void testRandomFailurePropagates() throws Exception {
    CryptoProvider provider = mock(CryptoProvider.class);
    when(provider.getRandomBytes(32)).thenThrow(new CryptoFailureException("no entropy"));

    try {
      IdentityKeyPair.generate(provider);
      fail();
    } catch (CryptoFailureException e) {
      assertEquals(ErrorCode.UNKNOWN_INTERNAL, ErrorCode.forThrowable(e));
    }
  }

  @Test
  public void testIdentityKeyCopiesItsBytes() {
    byte[] serialized = {5, 1, 2};
    IdentityKey key = new IdentityKey(serialized);

    serialized[1] = 0;
    key.serialize()[2] = 0;

    assertEquals(new IdentityKey(new byte[] {5, 1, 2}), key);
    assertNotEquals(new IdentityKey(new byte[] {5, 1}), key);
  }
}
