//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.signal.protocolstore.CryptoFailureException;
import org.signal.protocolstore.IdentityKey;
import org.signal.protocolstore.IdentityKeyPair;
import org.signal.protocolstore.InvalidKeyIdException;
import org.signal.protocolstore.SignalProtocolAddress;
import org.signal.protocolstore.crypto.CryptoProvider;
import org.signal.protocolstore.groups.SenderKeyName;
import org.signal.protocolstore.groups.state.InMemorySenderKeyStore;
import org.signal.protocolstore.groups.state.SenderKeyRecord;
import org.signal.protocolstore.groups.state.SenderKeyStore;
import org.signal.protocolstore.logging.Log;
import org.signal.protocolstore.state.impl.InMemoryIdentityKeyStore;
import org.signal.protocolstore.state.impl.InMemoryPreKeyStore;
import org.signal.protocolstore.state.impl.InMemorySessionStore;
import org.signal.protocolstore.state.impl.InMemorySignedPreKeyStore;
import org.signal.protocolstore.util.KeyHelper;

/**
 * The single handle the protocol engine holds for all of its persistent state.
 *
 * <p>A context owns the five stores it was built with and destroys each distinct store exactly
 * once when it is closed, even if an earlier store fails to tear down. Every operation on a closed
 * context throws {@link IllegalStateException}.
 *
 * <p>Contexts are not meant to be shared between engine instances. Callers that do so must
 * provide their own mutual exclusion.
 */
public final class StoreContext implements SignalProtocolStore, AutoCloseable {

  private static final String TAG = StoreContext.class.getSimpleName();

  private final CryptoProvider cryptoProvider;
  private final SessionStore sessionStore;
  private final PreKeyStore preKeyStore;
  private final SignedPreKeyStore signedPreKeyStore;
  private final IdentityKeyStore identityKeyStore;
  private final SenderKeyStore senderKeyStore;

  private boolean closed;

  private StoreContext(Builder builder, IdentityKeyStore identityKeyStore) {
    this.cryptoProvider = builder.cryptoProvider;
    this.sessionStore =
        builder.sessionStore != null ? builder.sessionStore : new InMemorySessionStore();
    this.preKeyStore =
        builder.preKeyStore != null ? builder.preKeyStore : new InMemoryPreKeyStore();
    this.signedPreKeyStore =
        builder.signedPreKeyStore != null
            ? builder.signedPreKeyStore
            : new InMemorySignedPreKeyStore();
    this.identityKeyStore = identityKeyStore;
    this.senderKeyStore =
        builder.senderKeyStore != null ? builder.senderKeyStore : new InMemorySenderKeyStore();
  }

  public static Builder newBuilder(CryptoProvider cryptoProvider) {
    return new Builder(cryptoProvider);
  }

  /** A context backed entirely by in-memory stores, with a freshly generated local identity. */
  public static StoreContext createInMemory(CryptoProvider cryptoProvider)
      throws CryptoFailureException {
    return newBuilder(cryptoProvider).build();
  }

  public CryptoProvider getCryptoProvider() {
    checkOpen();
    return cryptoProvider;
  }

  public SessionStore getSessionStore() {
    checkOpen();
    return sessionStore;
  }

  public PreKeyStore getPreKeyStore() {
    checkOpen();
    return preKeyStore;
  }

  public SignedPreKeyStore getSignedPreKeyStore() {
    checkOpen();
    return signedPreKeyStore;
  }

  public IdentityKeyStore getIdentityKeyStore() {
    checkOpen();
    return identityKeyStore;
  }

  public SenderKeyStore getSenderKeyStore() {
    checkOpen();
    return senderKeyStore;
  }

  // SessionStore

  @Override
  public SessionRecord loadSession(SignalProtocolAddress address) {
    return getSessionStore().loadSession(address);
  }

  @Override
  public List<Integer> getSubDeviceSessions(String name) {
    return getSessionStore().getSubDeviceSessions(name);
  }

  @Override
  public void storeSession(SignalProtocolAddress address, SessionRecord record) {
    getSessionStore().storeSession(address, record);
  }

  @Override
  public boolean containsSession(SignalProtocolAddress address) {
    return getSessionStore().containsSession(address);
  }

  @Override
  public boolean deleteSession(SignalProtocolAddress address) {
    return getSessionStore().deleteSession(address);
  }

  @Override
  public int deleteAllSessions(String name) {
    return getSessionStore().deleteAllSessions(name);
  }

  // PreKeyStore

  @Override
  public PreKeyRecord loadPreKey(int preKeyId) throws InvalidKeyIdException {
    return getPreKeyStore().loadPreKey(preKeyId);
  }

  @Override
  public void storePreKey(int preKeyId, PreKeyRecord record) {
    getPreKeyStore().storePreKey(preKeyId, record);
  }

  @Override
  public boolean containsPreKey(int preKeyId) {
    return getPreKeyStore().containsPreKey(preKeyId);
  }

  @Override
  public void removePreKey(int preKeyId) {
    getPreKeyStore().removePreKey(preKeyId);
  }

  // SignedPreKeyStore

  @Override
  public SignedPreKeyRecord loadSignedPreKey(int signedPreKeyId) throws InvalidKeyIdException {
    return getSignedPreKeyStore().loadSignedPreKey(signedPreKeyId);
  }

  @Override
  public List<SignedPreKeyRecord> loadSignedPreKeys() {
    return getSignedPreKeyStore().loadSignedPreKeys();
  }

  @Override
  public void storeSignedPreKey(int signedPreKeyId, SignedPreKeyRecord record) {
    getSignedPreKeyStore().storeSignedPreKey(signedPreKeyId, record);
  }

  @Override
  public boolean containsSignedPreKey(int signedPreKeyId) {
    return getSignedPreKeyStore().containsSignedPreKey(signedPreKeyId);
  }

  @Override
  public void removeSignedPreKey(int signedPreKeyId) {
    getSignedPreKeyStore().removeSignedPreKey(signedPreKeyId);
  }

  // IdentityKeyStore

  @Override
  public IdentityKeyPair getIdentityKeyPair() {
    return getIdentityKeyStore().getIdentityKeyPair();
  }

  @Override
  public int getLocalRegistrationId() {
    return getIdentityKeyStore().getLocalRegistrationId();
  }

  @Override
  public IdentityChange saveIdentity(String name, IdentityKey identityKey) {
    return getIdentityKeyStore().saveIdentity(name, identityKey);
  }

  @Override
  public boolean isTrustedIdentity(String name, IdentityKey identityKey) {
    return getIdentityKeyStore().isTrustedIdentity(name, identityKey);
  }

  @Override
  public IdentityKey getIdentity(String name) {
    return getIdentityKeyStore().getIdentity(name);
  }

  // SenderKeyStore

  @Override
  public void storeSenderKey(SenderKeyName senderKeyName, SenderKeyRecord record) {
    getSenderKeyStore().storeSenderKey(senderKeyName, record);
  }

  @Override
  public SenderKeyRecord loadSenderKey(SenderKeyName senderKeyName) {
    return getSenderKeyStore().loadSenderKey(senderKeyName);
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /** Equivalent to {@link #close()}. */
  @Override
  public void destroy() {
    close();
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;

    Log.d(TAG, "Destroying store context");

    // One object may fill several roles; it is still destroyed only once.
    Set<DestroyableStore> destroyed = Collections.newSetFromMap(new IdentityHashMap<>());
    RuntimeException failure = null;
    for (DestroyableStore store :
        Arrays.asList(
            sessionStore, preKeyStore, signedPreKeyStore, identityKeyStore, senderKeyStore)) {
      if (!destroyed.add(store)) {
        continue;
      }

      try {
        store.destroy();
      } catch (RuntimeException e) {
        Log.w(TAG, "Failed to destroy " + store.getClass().getSimpleName(), e);
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }

    if (failure != null) {
      throw failure;
    }
  }

  private synchronized void checkOpen() {
    if (closed) {
      throw new IllegalStateException("store context has been closed");
    }
  }

  public static final class Builder {
    private final CryptoProvider cryptoProvider;

    private SessionStore sessionStore;
    private PreKeyStore preKeyStore;
    private SignedPreKeyStore signedPreKeyStore;
    private IdentityKeyStore identityKeyStore;
    private SenderKeyStore senderKeyStore;

    private Builder(CryptoProvider cryptoProvider) {
      this.cryptoProvider = Objects.requireNonNull(cryptoProvider, "cryptoProvider");
    }

    public Builder setSessionStore(SessionStore sessionStore) {
      this.sessionStore = sessionStore;
      return this;
    }

    public Builder setPreKeyStore(PreKeyStore preKeyStore) {
      this.preKeyStore = preKeyStore;
      return this;
    }

    public Builder setSignedPreKeyStore(SignedPreKeyStore signedPreKeyStore) {
      this.signedPreKeyStore = signedPreKeyStore;
      return this;
    }

    public Builder setIdentityKeyStore(IdentityKeyStore identityKeyStore) {
      this.identityKeyStore = identityKeyStore;
      return this;
    }

    public Builder setSenderKeyStore(SenderKeyStore senderKeyStore) {
      this.senderKeyStore = senderKeyStore;
      return this;
    }

    /**
     * Build the context. Stores that were not set are in-memory; a missing identity store is
     * created with a new identity key pair and registration ID drawn from the crypto provider.
     *
     * @throws CryptoFailureException if the local identity cannot be generated.
     */
    public StoreContext build() throws CryptoFailureException {
      IdentityKeyStore identityKeyStore = this.identityKeyStore;
      if (identityKeyStore == null) {
        identityKeyStore =
            new InMemoryIdentityKeyStore(
                IdentityKeyPair.generate(cryptoProvider),
                KeyHelper.generateRegistrationId(cryptoProvider, false));
      }
      return new StoreContext(this, identityKeyStore);
    }
  }
}
