//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore;

/**
 * Thrown when a caller passes parameters a primitive cannot accept, such as an IV of the wrong
 * size or an unsupported cipher and key length combination. Nothing has been computed when this
 * is thrown.
 */
public class InvalidArgumentException extends Exception {
  public InvalidArgumentException(String detailMessage) {
    super(detailMessage);
  }
}
