package com.dynamics.sfg.wiring;

import com.dynamics.sfg.engine.RunBuffer;
import com.lmax.disruptor.RingBuffer;

/**
 * Producer side of the hand-off: worker threads claim a slot, fill it and
 * publish. Safe for concurrent use with a multi-producer ring buffer.
 */
public final class RepetitionPublisher {
    private final RingBuffer<RepetitionEvent> ringBuffer;

    public RepetitionPublisher(RingBuffer<RepetitionEvent> ringBuffer) {
        this.ringBuffer = ringBuffer;
    }

    public void publishCompleted(RunBuffer buffer) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setCompleted(buffer);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    public void publishFailed(int repetition, Throwable error) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setFailed(repetition, error);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    public void publishCancelled(int repetition) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setCancelled(repetition);
        } finally {
            ringBuffer.publish(sequence);
        }
    }
}
