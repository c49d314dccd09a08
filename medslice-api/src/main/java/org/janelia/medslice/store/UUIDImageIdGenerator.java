package org.janelia.medslice.store;

import java.util.UUID;

public class UUIDImageIdGenerator implements ImageIdGenerator {
    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }
}
