//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Test;
import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.IdentityKey;
import org.signal.protocolstore.IdentityKeyPair;
import org.signal.protocolstore.InvalidKeyIdException;
import org.signal.protocolstore.SignalProtocolAddress;
import org.signal.protocolstore.crypto.CryptoProvider;
import org.signal.protocolstore.groups.SenderKeyName;
import org.signal.protocolstore.groups.state.SenderKeyRecord;
import org.signal.protocolstore.groups.state.SenderKeyStore;
import org.signal.protocolstore.state.impl.InMemoryIdentityKeyStore;
import org.signal.protocolstore.util.TestLogger;

public class StoreContextTest {
  @ClassRule public static final TestLogger logger = new TestLogger();

  private CryptoProvider cryptoProvider;

  @Before
  public void setUp() throws Exception {
    SecureRandom random = new SecureRandom();
    cryptoProvider = mock(CryptoProvider.class);
    when(cryptoProvider.getRandomBytes(anyInt()))
        .thenAnswer(
            invocation -> {
              int length = invocation.getArgument(0);
              byte[] bytes = new byte[length];
              random.nextBytes(bytes);
              return bytes;
            });
  }

  @Test
  public void testInMemoryContextGeneratesLocalIdentity() throws Exception {
    try (StoreContext context = StoreContext.createInMemory(cryptoProvider)) {
      IdentityKeyPair identity = context.getIdentityKeyPair();
      assertEquals(33, identity.getPublicKey().size());
      assertEquals(IdentityKeyPair.DJB_TYPE, identity.getPublicKey().serialize()[0]);
      assertEquals(32, identity.getPrivateKey().length);

      int registrationId = context.getLocalRegistrationId();
      assertTrue(registrationId >= 1 && registrationId <= 16380);

      assertEquals(identity.getPublicKey(), context.getIdentityKeyPair().getPublicKey());
      assertEquals(registrationId, context.getLocalRegistrationId());
    }
  }

  @Test
  public void testDelegatesToEachStore() throws Exception {
    SignalProtocolAddress address = new SignalProtocolAddress("alice", 1);
    SenderKeyName senderKeyName = new SenderKeyName("group", address);

    try (StoreContext context = StoreContext.createInMemory(cryptoProvider)) {
      context.storeSession(address, new SessionRecord(new byte[] {1}));
      context.storePreKey(1, new PreKeyRecord(new byte[] {2}));
      context.storeSignedPreKey(1, new SignedPreKeyRecord(new byte[] {3}));
      context.saveIdentity("alice", new IdentityKey(new byte[] {4}));
      context.storeSenderKey(senderKeyName, new SenderKeyRecord(new byte[] {5}));

      assertArrayEquals(new byte[] {1}, context.getSessionStore().loadSession(address).serialize());
      assertArrayEquals(new byte[] {2}, context.getPreKeyStore().loadPreKey(1).serialize());
      assertFalse(context.containsPreKey(2));
      assertArrayEquals(
          new byte[] {3}, context.getSignedPreKeyStore().loadSignedPreKey(1).serialize());
      assertFalse(context.isTrustedIdentity("alice", new IdentityKey(new byte[] {6})));
      assertArrayEquals(
          new byte[] {5},
          context.getSenderKeyStore().loadSenderKey(senderKeyName).serialize());
    }
  }

  @Test
  public void testSuppliedStoresAreUsedAndDestroyedOnce() throws Exception {
    SessionStore sessionStore = mock(SessionStore.class);
    SenderKeyStore senderKeyStore = mock(SenderKeyStore.class);
    IdentityKeyStore identityKeyStore =
        new InMemoryIdentityKeyStore(
            new IdentityKeyPair(new IdentityKey(new byte[] {5, 1}), new byte[] {2}), 42);

    StoreContext context =
        StoreContext.newBuilder(cryptoProvider)
            .setSessionStore(sessionStore)
            .setSenderKeyStore(senderKeyStore)
            .setIdentityKeyStore(identityKeyStore)
            .build();

    assertEquals(42, context.getLocalRegistrationId());
    verify(cryptoProvider, never()).getRandomBytes(anyInt());

    assertFalse(context.containsSession(new SignalProtocolAddress("bob", 3)));
    verify(sessionStore).containsSession(new SignalProtocolAddress("bob", 3));

    context.close();
    context.close();

    verify(sessionStore, times(1)).destroy();
    verify(senderKeyStore, times(1)).destroy();
  }

  @Test
  public void testSharedStoreObjectIsDestroyedOnce() throws Exception {
    SignalProtocolStore combined = mock(SignalProtocolStore.class);

    StoreContext context =
        StoreContext.newBuilder(cryptoProvider)
            .setSessionStore(combined)
            .setPreKeyStore(combined)
            .setSignedPreKeyStore(combined)
            .setIdentityKeyStore(combined)
            .setSenderKeyStore(combined)
            .build();
    context.close();

    verify(combined, times(1)).destroy();
  }

  @Test
  public void testFailedTeardownStillReleasesRemainingStores() throws Exception {
    SessionStore sessionStore = mock(SessionStore.class);
    PreKeyStore preKeyStore = mock(PreKeyStore.class);
    SenderKeyStore senderKeyStore = mock(SenderKeyStore.class);
    IllegalStateException sessionFailure = new IllegalStateException("session teardown");
    IllegalStateException senderKeyFailure = new IllegalStateException("sender key teardown");
    doThrow(sessionFailure).when(sessionStore).destroy();
    doThrow(senderKeyFailure).when(senderKeyStore).destroy();

    StoreContext context =
        StoreContext.newBuilder(cryptoProvider)
            .setSessionStore(sessionStore)
            .setPreKeyStore(preKeyStore)
            .setSenderKeyStore(senderKeyStore)
            .build();

    try {
      context.close();
      fail();
    } catch (IllegalStateException e) {
      assertSame(sessionFailure, e);
      assertArrayEquals(new Throwable[] {senderKeyFailure}, e.getSuppressed());
    }

    verify(preKeyStore, times(1)).destroy();
    verify(senderKeyStore, times(1)).destroy();
    assertTrue(context.isClosed());

    context.close();
    verify(sessionStore, times(1)).destroy();
  }

  @Test
  public void testClosedContextRejectsUse() throws Exception {
    StoreContext context = StoreContext.createInMemory(cryptoProvider);
    context.storePreKey(1, new PreKeyRecord(new byte[] {1}));

    context.close();
    assertTrue(context.isClosed());

    try {
      context.loadPreKey(1);
      fail();
    } catch (IllegalStateException expected) {
    }

    try {
      context.getSessionStore();
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  @Test
  public void testTeardownReleasesRecords() throws Exception {
    StoreContext context = StoreContext.createInMemory(cryptoProvider);
    PreKeyStore preKeyStore = context.getPreKeyStore();
    preKeyStore.storePreKey(1, new PreKeyRecord(new byte[] {1}));

    context.close();

    try {
      preKeyStore.loadPreKey(1);
      fail();
    } catch (InvalidKeyIdException expected) {
    }
  }

  @Test
  public void testIdentityGenerationFailureFailsBuild() throws Exception {
    when(cryptoProvider.getRandomBytes(anyInt())).thenThrow(new CryptoFailureException("broken"));

    try {
      StoreContext.createInMemory(cryptoProvider);
      fail();
    } catch (CryptoFailureException expected) {
    }
  }
}
