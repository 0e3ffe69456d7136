//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state;

/** A store whose contents are released when its owning {@link StoreContext} is closed. */
public interface DestroyableStore {

  /**
   * Release every record held by this store. Called once, when the owning context is closed;
   * the store is not used afterwards.
   */
  default void destroy() {}
}
