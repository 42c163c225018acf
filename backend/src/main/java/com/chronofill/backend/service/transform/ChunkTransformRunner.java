package com.chronofill.backend.service.transform;

/**
 * Runs the data transformation for one chunk. Implementations block until the work is done
 * and may throw; the caller records any exception as a chunk failure.
 */
public interface ChunkTransformRunner {

    ChunkTransformResult run(ChunkTransformRequest request);
}
