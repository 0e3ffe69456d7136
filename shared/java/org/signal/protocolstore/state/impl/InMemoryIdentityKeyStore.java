//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state.impl;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.signal.protocolstore.IdentityKey;
import org.signal.protocolstore.IdentityKeyPair;
import org.signal.protocolstore.logging.Log;
import org.signal.protocolstore.state.IdentityKeyStore;

public class InMemoryIdentityKeyStore implements IdentityKeyStore {

  private static final String TAG = InMemoryIdentityKeyStore.class.getSimpleName();

  private final Map<Long, IdentityKey> trustedKeys = new HashMap<>();

  private final IdentityKeyPair identityKeyPair;
  private final int localRegistrationId;

  public InMemoryIdentityKeyStore(IdentityKeyPair identityKeyPair, int localRegistrationId) {
    this.identityKeyPair = Objects.requireNonNull(identityKeyPair, "identityKeyPair");
    this.localRegistrationId = localRegistrationId;
  }

  @Override
  public IdentityKeyPair getIdentityKeyPair() {
    return new IdentityKeyPair(identityKeyPair.getPublicKey(), identityKeyPair.getPrivateKey());
  }

  @Override
  public int getLocalRegistrationId() {
    return localRegistrationId;
  }

  @Override
  public synchronized IdentityChange saveIdentity(String name, IdentityKey identityKey) {
    Objects.requireNonNull(identityKey, "identityKey");
    IdentityKey existing = trustedKeys.put(RecipientDeviceKey.recipientIdOf(name), identityKey);

    if (existing != null && !existing.equals(identityKey)) {
      Log.i(TAG, "Replacing saved identity for " + name);
      return IdentityChange.REPLACED_EXISTING;
    } else {
      return IdentityChange.NEW_OR_UNCHANGED;
    }
  }

  @Override
  public synchronized boolean isTrustedIdentity(String name, IdentityKey identityKey) {
    IdentityKey trusted = trustedKeys.get(RecipientDeviceKey.recipientIdOf(name));
    return (trusted == null || trusted.equals(identityKey));
  }

  @Override
  public synchronized IdentityKey getIdentity(String name) {
    return trustedKeys.get(RecipientDeviceKey.recipientIdOf(name));
  }

  @Override
  public synchronized void destroy() {
    trustedKeys.clear();
  }
}
