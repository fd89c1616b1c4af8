package com.dcruver.notebook.hierarchy;

import lombok.Value;

/**
 * Stored {@code index-type} compared with the one derived from the path.
 */
@Value
public class IndexTypeCheck {
    Object stored;
    IndexType derived;
    boolean mismatch;

    public boolean isStoredPresent() {
        return stored != null;
    }
}
