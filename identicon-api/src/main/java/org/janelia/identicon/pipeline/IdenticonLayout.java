package org.janelia.identicon.pipeline;

import org.janelia.identicon.model.HashBytes;

/**
 * Fixed geometry of an identicon. CELL_SIZE * GRID_SIZE must equal CANVAS_SIZE.
 */
public final class IdenticonLayout {
    public static final int GRID_SIZE = 5;
    public static final int CELL_SIZE = 50;
    public static final int CANVAS_SIZE = GRID_SIZE * CELL_SIZE;
    public static final int CELL_COUNT = GRID_SIZE * GRID_SIZE;

    public static final int HASH_LENGTH = HashBytes.LENGTH;
    // bytes per grid row before mirroring
    public static final int GROUP_SIZE = (GRID_SIZE + 1) / 2;
    public static final int USED_HASH_BYTES = GROUP_SIZE * GRID_SIZE;

    private IdenticonLayout() {
    }
}
