//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state.impl;

import java.util.HashMap;
import java.util.Map;
import org.signal.protocolstore.InvalidKeyIdException;
import org.signal.protocolstore.state.PreKeyRecord;
import org.signal.protocolstore.state.PreKeyStore;

public class InMemoryPreKeyStore implements PreKeyStore {

  private final Map<Integer, byte[]> store = new HashMap<>();

  @Override
  public synchronized PreKeyRecord loadPreKey(int preKeyId) throws InvalidKeyIdException {
    byte[] serialized = store.get(preKeyId);
    if (serialized == null) {
      throw new InvalidKeyIdException("No such prekeyrecord! " + preKeyId);
    }

    return new PreKeyRecord(serialized);
  }

  @Override
  public synchronized void storePreKey(int preKeyId, PreKeyRecord record) {
    store.put(preKeyId, record.serialize());
  }

  @Override
  public synchronized boolean containsPreKey(int preKeyId) {
    return store.containsKey(preKeyId);
  }

  @Override
  public synchronized void removePreKey(int preKeyId) {
    store.remove(preKeyId);
  }

  @Override
  public synchronized void destroy() {
    store.clear();
  }
}
