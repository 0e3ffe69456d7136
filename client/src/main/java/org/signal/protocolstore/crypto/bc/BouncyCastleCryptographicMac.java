//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto.bc;

import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.macs.HMac;
import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.crypto.CryptographicMac;

class BouncyCastleCryptographicMac implements CryptographicMac {

  private HMac hmac;

  BouncyCastleCryptographicMac(HMac hmac) {
    this.hmac = hmac;
  }

  @Override
  public void update(byte[] input, int offset, int len) {
    checkOpen().update(input, offset, len);
  }

  @Override
  public byte[] finish() throws CryptoFailureException {
    HMac hmac = checkOpen();
    byte[] output = new byte[hmac.getMacSize()];
    try {
      int length = hmac.doFinal(output, 0);
      if (length != output.length) {
        throw new CryptoFailureException("MAC produced " + length + " bytes");
      }
      return output;
    } catch (DataLengthException | IllegalStateException e) {
      throw new CryptoFailureException(e);
    }
  }

  @Override
  public int getMacLength() {
    return checkOpen().getMacSize();
  }

  @Override
  public void close() {
    if (hmac != null) {
      hmac.reset();
      hmac = null;
    }
  }

  private HMac checkOpen() {
    if (hmac == null) {
      throw new IllegalStateException("Mac instance has been closed");
    }
    return hmac;
  }
}
