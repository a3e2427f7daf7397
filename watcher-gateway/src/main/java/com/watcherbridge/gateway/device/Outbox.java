package com.watcherbridge.gateway.device;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * FIFO of commands awaiting an active session. Owned by the gateway lane;
 * only {@link #size()} may be read from other threads.
 */
public class Outbox {

    private final Deque<CommandEnvelope> queue = new ArrayDeque<>();
    private long nextSequence = 1;
    private volatile int size;

    public CommandEnvelope enqueue(String text) {
        CommandEnvelope envelope = new CommandEnvelope(nextSequence++, text);
        queue.addLast(envelope);
        size = queue.size();
        return envelope;
    }

    /**
     * @return the oldest command, or {@code null} when empty
     */
    public CommandEnvelope poll() {
        CommandEnvelope envelope = queue.pollFirst();
        size = queue.size();
        return envelope;
    }

    /** Put a command that failed delivery back at the head. */
    public void pushFront(CommandEnvelope envelope) {
        queue.addFirst(envelope);
        size = queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return size;
    }
}
