//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore;

/**
 * Integer result codes understood by engines that report store and provider outcomes as codes
 * rather than exceptions.
 */
public enum ErrorCode {
  OK(0),
  NOT_FOUND(1),
  NO_MEMORY(-12),
  INVALID_ARGUMENT(-22),
  UNKNOWN_INTERNAL(-1000),
  INVALID_KEY_ID(-1003);

  private final int code;

  ErrorCode(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public boolean isError() {
    return code < 0;
  }

  /**
   * Maps a failure raised by a store or crypto provider onto its result code.
   *
   * @param throwable the failure, or {@code null} for a successful call.
   * @return the code for the failure; anything unrecognized is {@link #UNKNOWN_INTERNAL}.
   */
  public static ErrorCode forThrowable(Throwable throwable) {
    if (throwable == null) {
      return OK;
    } else if (throwable instanceof InvalidKeyIdException) {
      return INVALID_KEY_ID;
    } else if (throwable instanceof InvalidArgumentException) {
      return INVALID_ARGUMENT;
    } else if (throwable instanceof OutOfMemoryError) {
      return NO_MEMORY;
    } else {
      return UNKNOWN_INTERNAL;
    }
  }

  public static ErrorCode forCode(int code) {
    for (ErrorCode value : values()) {
      if (value.code == code) {
        return value;
      }
    }
    throw new IllegalArgumentException("unknown error code: " + code);
  }
}
