//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.groups.state;

import org.signal.protocolstore.groups.SenderKeyName;
import org.signal.protocolstore.util.JenkinsHash;

/** Hashed (group, recipient, device) key for the in-memory sender key table. */
public record SenderKeyStoreKey(long groupId, long recipientId, int deviceId) {

  public static SenderKeyStoreKey of(SenderKeyName senderKeyName) {
    return new SenderKeyStoreKey(
        JenkinsHash.hash(senderKeyName.getGroupId()),
        JenkinsHash.hash(senderKeyName.getSender().getNameBytes()),
        senderKeyName.getSender().getDeviceId());
  }
}
