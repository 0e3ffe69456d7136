//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state;

import org.signal.protocolstore.IdentityKey;
import org.signal.protocolstore.IdentityKeyPair;

/**
 * Provides an interface to identity information.
 *
 * @author Moxie Marlinspike
 */
public interface IdentityKeyStore extends DestroyableStore {

  public enum IdentityChange {
    NEW_OR_UNCHANGED,
    REPLACED_EXISTING;
  }

  /**
   * Get the local client's identity key pair.
   *
   * @return The local client's persistent identity key pair.
   */
  public IdentityKeyPair getIdentityKeyPair();

  /**
   * Return the local client's registration ID.
   *
   * <p>Clients should maintain a registration ID, a random number between 1 and 16380 that's
   * generated once at install time.
   *
   * @return the local client's registration ID.
   */
  public int getLocalRegistrationId();

  /**
   * Save a remote client's identity key, replacing any key previously saved for that name.
   *
   * @param name The name of the remote client.
   * @param identityKey The remote client's identity key.
   * @return whether a different key was replaced.
   */
  public IdentityChange saveIdentity(String name, IdentityKey identityKey);

  /**
   * Verify a remote client's identity key.
   *
   * <p>Determine whether a remote client's identity is trusted. The convention is that the
   * TextSecure protocol is 'trust on first use.' This means that an identity key is considered
   * 'trusted' if there is no entry for the recipient in the local store, or if it matches the
   * saved key for a recipient in the local store. Only if it mismatches an entry in the local
   * store is it considered 'untrusted.'
   *
   * @param name The name of the remote client.
   * @param identityKey The identity key to verify.
   * @return true if trusted, false if untrusted.
   */
  public boolean isTrustedIdentity(String name, IdentityKey identityKey);

  /**
   * Return the saved public identity key for a remote client
   *
   * @param name The name of the remote client
   * @return The public identity key, or null if absent
   */
  public IdentityKey getIdentity(String name);
}
