//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.logging;

public class SignalProtocolLoggerProvider {

  private static volatile SignalProtocolLogger provider;
  private static volatile int maxLevel = SignalProtocolLogger.INFO;

  /**
   * Sets the least severe level that is forwarded to the installed logger.
   *
   * @param maxLevel The most verbose level that should be logged. Should be one of the constants
   *     from {@link SignalProtocolLogger}. Defaults to {@code INFO}.
   */
  public static void initializeLogging(int maxLevel) {
    if (maxLevel < SignalProtocolLogger.VERBOSE || maxLevel > SignalProtocolLogger.ASSERT) {
      throw new IllegalArgumentException("invalid log level");
    }
    SignalProtocolLoggerProvider.maxLevel = maxLevel;
  }

  public static int getMaxLevel() {
    return maxLevel;
  }

  public static SignalProtocolLogger getProvider() {
    return provider;
  }

  public static void setProvider(SignalProtocolLogger provider) {
    SignalProtocolLoggerProvider.provider = provider;
  }
}
