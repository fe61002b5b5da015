package com.folio.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process channel; a coordinator thread reads what workers send.
 */
public final class BlockingQueueProgressChannel implements ProgressChannel {

    private final BlockingQueue<ProgressEvent> queue = new LinkedBlockingQueue<>();

    @Override
    public void send(ProgressEvent event) {
        queue.add(event);
    }

    /** Next event, or null after the timeout. */
    public ProgressEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** Everything sent so far, oldest first. */
    public List<ProgressEvent> drain() {
        List<ProgressEvent> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }
}
