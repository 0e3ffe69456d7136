//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state.impl;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.*;

import java.util.List;
import org.junit.ClassRule;
import org.junit.Test;
import org.signal.protocolstore.SignalProtocolAddress;
import org.signal.protocolstore.state.SessionRecord;
import org.signal.protocolstore.state.SessionStore;
import org.signal.protocolstore.util.TestLogger;

public class InMemorySessionStoreTest {
  @ClassRule public static final TestLogger logger = new TestLogger();

  private static final SignalProtocolAddress ALICE_1 = new SignalProtocolAddress("alice", 1);

  @Test
  public void testStoreAndLoad() {
    SessionStore store = new InMemorySessionStore();
    byte[] serialized = {1, 2, 3, 4, 5};

    store.storeSession(ALICE_1, new SessionRecord(serialized));

    assertTrue(store.containsSession(ALICE_1));
    assertArrayEquals(serialized, store.loadSession(ALICE_1).serialize());
  }

  @Test
  public void testOverwriteReplacesRecord() {
    SessionStore store = new InMemorySessionStore();

    store.storeSession(ALICE_1, new SessionRecord(new byte[] {1}));
    store.storeSession(ALICE_1, new SessionRecord(new byte[] {2, 2}));

    assertArrayEquals(new byte[] {2, 2}, store.loadSession(ALICE_1).serialize());
    assertEquals(List.of(1), store.getSubDeviceSessions("alice"));
  }

  @Test
  public void testMissingSessionIsNull() {
    SessionStore store = new InMemorySessionStore();

    assertNull(store.loadSession(ALICE_1));
    assertFalse(store.containsSession(ALICE_1));

    store.storeSession(new SignalProtocolAddress("alice", 2), new SessionRecord(new byte[] {9}));
    assertNull(store.loadSession(ALICE_1));
  }

  @Test
  public void testEmptyRecordIsNotAbsent() {
    SessionStore store = new InMemorySessionStore();

    store.storeSession(ALICE_1, new SessionRecord(new byte[0]));

    assertTrue(store.containsSession(ALICE_1));
    assertEquals(0, store.loadSession(ALICE_1).serialize().length);
  }

  @Test
  public void testLoadedRecordIsACopy() {
    SessionStore store = new InMemorySessionStore();
    byte[] serialized = {1, 2, 3};
    store.storeSession(ALICE_1, new SessionRecord(serialized));

    serialized[0] = 42;
    byte[] loaded = store.loadSession(ALICE_1).serialize();
    loaded[1] = 42;

    assertArrayEquals(new byte[] {1, 2, 3}, store.loadSession(ALICE_1).serialize());
  }

  @Test
  public void testDeleteSession() {
    SessionStore store = new InMemorySessionStore();

    assertFalse(store.deleteSession(ALICE_1));

    store.storeSession(ALICE_1, new SessionRecord(new byte[] {1}));
    assertTrue(store.deleteSession(ALICE_1));

    assertFalse(store.containsSession(ALICE_1));
    assertNull(store.loadSession(ALICE_1));
    assertFalse(store.deleteSession(ALICE_1));
  }

  @Test
  public void testSubDeviceSessions() {
    SessionStore store = populatedStore();

    assertThat(store.getSubDeviceSessions("alice"), containsInAnyOrder(1, 2, 5));
    assertThat(store.getSubDeviceSessions("bob"), containsInAnyOrder(1));
    assertThat(store.getSubDeviceSessions("carol"), empty());
  }

  @Test
  public void testDeleteAllSessions() {
    SessionStore store = populatedStore();

    assertEquals(3, store.deleteAllSessions("alice"));

    assertThat(store.getSubDeviceSessions("alice"), empty());
    assertFalse(store.containsSession(new SignalProtocolAddress("alice", 2)));
    assertTrue(store.containsSession(new SignalProtocolAddress("bob", 1)));
    assertArrayEquals(
        new byte[] {'b'}, store.loadSession(new SignalProtocolAddress("bob", 1)).serialize());

    assertEquals(0, store.deleteAllSessions("alice"));
  }

  @Test
  public void testDestroyReleasesEverything() {
    InMemorySessionStore store = populatedStore();

    store.destroy();

    assertThat(store.getSubDeviceSessions("alice"), empty());
    assertFalse(store.containsSession(new SignalProtocolAddress("bob", 1)));
  }

  private static InMemorySessionStore populatedStore() {
    InMemorySessionStore store = new InMemorySessionStore();
    for (int deviceId : new int[] {1, 2, 5}) {
      store.storeSession(
          new SignalProtocolAddress("alice", deviceId), new SessionRecord(new byte[] {'a'}));
    }
    store.storeSession(new SignalProtocolAddress("bob", 1), new SessionRecord(new byte[] {'b'}));
    return store;
  }
}
