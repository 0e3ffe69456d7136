//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state.impl;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import org.signal.protocolstore.SignalProtocolAddress;
import org.signal.protocolstore.logging.Log;
import org.signal.protocolstore.state.SessionRecord;
import org.signal.protocolstore.state.SessionStore;

public class InMemorySessionStore implements SessionStore {

  private static final String TAG = InMemorySessionStore.class.getSimpleName();

  private final Map<RecipientDeviceKey, byte[]> sessions = new HashMap<>();

  public InMemorySessionStore() {}

  @Override
  public synchronized SessionRecord loadSession(SignalProtocolAddress remoteAddress) {
    byte[] serialized = sessions.get(RecipientDeviceKey.of(remoteAddress));
    if (serialized == null) {
      return null;
    }
    return new SessionRecord(serialized);
  }

  @Override
  public synchronized List<Integer> getSubDeviceSessions(String name) {
    long recipientId = RecipientDeviceKey.recipientIdOf(name);
    List<Integer> deviceIds = new LinkedList<>();

    for (RecipientDeviceKey key : sessions.keySet()) {
      if (key.recipientId() == recipientId) {
        deviceIds.add(key.deviceId());
      }
    }

    return deviceIds;
  }

  @Override
  public synchronized void storeSession(SignalProtocolAddress address, SessionRecord record) {
    sessions.put(RecipientDeviceKey.of(address), record.serialize());
  }

  @Override
  public synchronized boolean containsSession(SignalProtocolAddress address) {
    return sessions.containsKey(RecipientDeviceKey.of(address));
  }

  @Override
  public synchronized boolean deleteSession(SignalProtocolAddress address) {
    return sessions.remove(RecipientDeviceKey.of(address)) != null;
  }

  @Override
  public synchronized int deleteAllSessions(String name) {
    long recipientId = RecipientDeviceKey.recipientIdOf(name);
    int removed = 0;

    Iterator<RecipientDeviceKey> keys = sessions.keySet().iterator();
    while (keys.hasNext()) {
      if (keys.next().recipientId() == recipientId) {
        keys.remove();
        removed++;
      }
    }

    return removed;
  }

  @Override
  public synchronized void destroy() {
    Log.d(TAG, "Releasing " + sessions.size() + " sessions");
    sessions.clear();
  }
}
