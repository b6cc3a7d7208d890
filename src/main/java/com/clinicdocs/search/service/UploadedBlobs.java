package com.clinicdocs.search.service;

import com.clinicdocs.search.model.StorageLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blobs uploaded by the workers of one batch. Each blob is handed to exactly one owner for
 * cleanup: the worker through {@link #release}, or the batch through {@link #cancelAndDrain}.
 */
final class UploadedBlobs {

    private final Queue<StorageLocation> blobs = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return {@code false} if the batch has been cancelled
     */
    boolean track(StorageLocation location) {
        blobs.add(location);
        return !cancelled.get();
    }

    /**
     * @return {@code true} if the caller now owns the blob and must delete it
     */
    boolean release(StorageLocation location) {
        return blobs.remove(location);
    }

    List<StorageLocation> cancelAndDrain() {
        cancelled.set(true);
        List<StorageLocation> drained = new ArrayList<>();
        StorageLocation next;
        while ((next = blobs.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }
}
