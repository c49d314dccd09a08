package org.janelia.medslice.store;

public interface ImageIdGenerator {
    /**
     * @return an identifier that was never returned before
     */
    String generateId();
}
