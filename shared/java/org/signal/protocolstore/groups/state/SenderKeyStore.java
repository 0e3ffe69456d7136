//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.groups.state;

import org.signal.protocolstore.groups.SenderKeyName;
import org.signal.protocolstore.state.DestroyableStore;

public interface SenderKeyStore extends DestroyableStore {

  /**
   * Commit to storage the {@link SenderKeyRecord} for a given (groupId + senderId + deviceId)
   * tuple.
   *
   * @param senderKeyName the (groupId + senderId + deviceId) tuple.
   * @param record the current SenderKeyRecord for the specified senderKeyName.
   */
  public void storeSenderKey(SenderKeyName senderKeyName, SenderKeyRecord record);

  /**
   * Returns a copy of the {@link SenderKeyRecord} corresponding to the senderKeyName, or
   * {@code null} if one does not exist.
   *
   * <p>It is important that implementations return a copy of the current durable information.
   * The returned SenderKeyRecord may be modified, but those changes should not have an effect on
   * the durable session state (what is returned by subsequent calls to this method) without the
   * store method being called here first.
   *
   * @param senderKeyName The (groupId + senderId + deviceId) tuple.
   * @return a copy of the SenderKeyRecord corresponding to the senderKeyName, or {@code null} if
   *     one does not currently exist.
   */
  public SenderKeyRecord loadSenderKey(SenderKeyName senderKeyName);
}
