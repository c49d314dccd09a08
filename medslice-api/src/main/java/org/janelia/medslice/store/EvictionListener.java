package org.janelia.medslice.store;

import com.google.common.cache.RemovalCause;

/**
 * Notified whenever a record leaves the store, either explicitly or because of the capacity limit.
 */
public interface EvictionListener {
    void onEviction(String imageId, RemovalCause cause);
}
