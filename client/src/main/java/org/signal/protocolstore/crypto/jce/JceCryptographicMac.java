//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto.jce;

import javax.crypto.Mac;
import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.crypto.CryptographicMac;

class JceCryptographicMac implements CryptographicMac {

  private Mac mac;

  JceCryptographicMac(Mac mac) {
    this.mac = mac;
  }

  @Override
  public void update(byte[] input, int offset, int len) {
    checkOpen().update(input, offset, len);
  }

  @Override
  public byte[] finish() throws CryptoFailureException {
    Mac mac = checkOpen();
    try {
      byte[] result = mac.doFinal();
      if (result.length != mac.getMacLength()) {
        throw new CryptoFailureException("MAC produced " + result.length + " bytes");
      }
      return result;
    } catch (IllegalStateException e) {
      throw new CryptoFailureException(e);
    }
  }

  @Override
  public int getMacLength() {
    return checkOpen().getMacLength();
  }

  @Override
  public void close() {
    if (mac != null) {
      mac.reset();
      mac = null;
    }
  }

  private Mac checkOpen() {
    if (mac == null) {
      throw new IllegalStateException("Mac instance has been closed");
    }
    return mac;
  }
}
