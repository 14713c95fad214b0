package com.example.docimport;

import java.util.concurrent.Semaphore;

/**
 * Holds documents that completed out of turn and releases them strictly by sequence index.
 * <p>
 * Results live in a ring of {@code window} slots keyed by {@code index % window}. The producer
 * takes one permit from {@link #permits()} per admitted record and a permit comes back each time
 * a document leaves the ring, so an admitted index is always below {@code nextExpected + window}
 * and two pending results never share a slot.
 */
final class OrderedReassembler {

    @FunctionalInterface
    interface Release {
        /** Hands a document downstream; false when the stream is being torn down. */
        boolean release(Document doc) throws InterruptedException;
    }

    private final Document[] ring;
    private final Semaphore permits;
    private final Release downstream;
    private long nextExpected = 0;

    OrderedReassembler(int window, Release downstream) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1");
        }
        this.ring = new Document[window];
        this.permits = new Semaphore(window);
        this.downstream = downstream;
    }

    Semaphore permits() {
        return permits;
    }

    synchronized long nextExpected() {
        return nextExpected;
    }

    /**
     * Stores the result for {@code index} and releases the longest contiguous run starting at the
     * next expected index.
     */
    synchronized void complete(long index, Document doc) throws InterruptedException {
        if (index < nextExpected || index >= nextExpected + ring.length) {
            throw new IllegalStateException("index " + index + " outside window starting at " + nextExpected);
        }
        ring[slot(index)] = doc;
        Document head;
        while ((head = ring[slot(nextExpected)]) != null) {
            if (!downstream.release(head)) {
                return;
            }
            ring[slot(nextExpected)] = null;
            nextExpected++;
            permits.release();
        }
    }

    private int slot(long index) {
        return (int) (index % ring.length);
    }
}
