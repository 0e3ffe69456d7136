//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.groups;

import java.util.Objects;
import org.signal.protocolstore.SignalProtocolAddress;

/** A representation of a (groupId + senderId + deviceId) tuple. */
public class SenderKeyName {

  private final String groupId;
  private final SignalProtocolAddress sender;

  public SenderKeyName(String groupId, SignalProtocolAddress sender) {
    this.groupId = Objects.requireNonNull(groupId, "groupId");
    this.sender = Objects.requireNonNull(sender, "sender");
  }

  public SenderKeyName(String groupId, String senderName, int senderDeviceId) {
    this(groupId, new SignalProtocolAddress(senderName, senderDeviceId));
  }

  public String getGroupId() {
    return groupId;
  }

  public SignalProtocolAddress getSender() {
    return sender;
  }

  @Override
  public String toString() {
    return groupId + "::" + sender;
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof SenderKeyName)) return false;

    SenderKeyName that = (SenderKeyName) other;

    return this.groupId.equals(that.groupId) && this.sender.equals(that.sender);
  }

  @Override
  public int hashCode() {
    return this.groupId.hashCode() ^ this.sender.hashCode();
  }
}
