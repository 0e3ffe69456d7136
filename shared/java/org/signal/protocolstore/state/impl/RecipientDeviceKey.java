//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state.impl;

import org.signal.protocolstore.SignalProtocolAddress;
import org.signal.protocolstore.util.JenkinsHash;

/**
 * Fixed-size key for per-device tables: the hashed recipient name plus the device ID.
 *
 * @see JenkinsHash
 */
public record RecipientDeviceKey(long recipientId, int deviceId) {

  public static RecipientDeviceKey of(SignalProtocolAddress address) {
    return new RecipientDeviceKey(
        JenkinsHash.hash(address.getNameBytes()), address.getDeviceId());
  }

  /** Same id as {@link #of} gives for an address carrying {@code name}. */
  public static long recipientIdOf(String name) {
    return JenkinsHash.hash(name);
  }
}
