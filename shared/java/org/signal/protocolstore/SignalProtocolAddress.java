//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

public class SignalProtocolAddress {

  private final String name;
  private final int deviceId;

  /**
   * @param name the identifier for the recipient
   * @param deviceId the identifier for the device
   */
  public SignalProtocolAddress(String name, int deviceId) {
    this.name = Objects.requireNonNull(name, "name");
    this.deviceId = deviceId;
  }

  public String getName() {
    return name;
  }

  /** The bytes composite store keys are derived from. */
  public byte[] getNameBytes() {
    return name.getBytes(StandardCharsets.UTF_8);
  }

  public int getDeviceId() {
    return deviceId;
  }

  @Override
  public String toString() {
    return name + "." + deviceId;
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof SignalProtocolAddress)) return false;

    SignalProtocolAddress that = (SignalProtocolAddress) other;
    return this.name.equals(that.name) && this.deviceId == that.deviceId;
  }

  @Override
  public int hashCode() {
    return this.name.hashCode() ^ this.deviceId;
  }
}
