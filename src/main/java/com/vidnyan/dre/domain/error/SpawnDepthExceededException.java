package com.vidnyan.dre.domain.error;

/**
 * A request would nest helper spawns deeper than allowed.
 */
public class SpawnDepthExceededException extends DynamicRequestException {

    private final int spawnDepth;
    private final int maxSpawnDepth;

    public SpawnDepthExceededException(int spawnDepth, int maxSpawnDepth) {
        super(String.format("Spawn depth %d exceeds maximum of %d", spawnDepth, maxSpawnDepth));
        this.spawnDepth = spawnDepth;
        this.maxSpawnDepth = maxSpawnDepth;
    }

    public int getSpawnDepth() {
        return spawnDepth;
    }

    public int getMaxSpawnDepth() {
        return maxSpawnDepth;
    }
}
