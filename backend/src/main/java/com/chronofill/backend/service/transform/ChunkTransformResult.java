package com.chronofill.backend.service.transform;

public record ChunkTransformResult(boolean successful, long rowsAffected, String errorMessage) {

    public static ChunkTransformResult success(long rowsAffected) {
        return new ChunkTransformResult(true, rowsAffected, null);
    }

    public static ChunkTransformResult failure(String errorMessage) {
        return new ChunkTransformResult(false, 0, errorMessage);
    }
}
