//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore;

/**
 * The underlying cryptographic library failed while computing a result.
 *
 * <p>Callers should abandon the protocol operation in progress rather than retry it.
 */
public class CryptoFailureException extends Exception {
  public CryptoFailureException(String detailMessage) {
    super(detailMessage);
  }

  public CryptoFailureException(String detailMessage, Throwable cause) {
    super(detailMessage, cause);
  }

  public CryptoFailureException(Throwable cause) {
    super(cause);
  }
}
