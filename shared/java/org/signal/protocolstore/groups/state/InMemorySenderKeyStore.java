//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.groups.state;

import java.util.HashMap;
import java.util.Map;
import org.signal.protocolstore.groups.SenderKeyName;

public class InMemorySenderKeyStore implements SenderKeyStore {

  private final Map<SenderKeyStoreKey, byte[]> store = new HashMap<>();

  @Override
  public synchronized void storeSenderKey(SenderKeyName senderKeyName, SenderKeyRecord record) {
    store.put(SenderKeyStoreKey.of(senderKeyName), record.serialize());
  }

  @Override
  public synchronized SenderKeyRecord loadSenderKey(SenderKeyName senderKeyName) {
    byte[] serialized = store.get(SenderKeyStoreKey.of(senderKeyName));

    if (serialized == null) {
      return null;
    } else {
      return new SenderKeyRecord(serialized);
    }
  }

  @Override
  public synchronized void destroy() {
    store.clear();
  }
}
