package com.sandwichtrader.observability;

import com.sandwichtrader.event.DecisionEvent;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Keeps the most recent strategy decisions in memory for the REST API.
 *
 * <p>The ring buffer holds {@value #RING_BUFFER_SIZE} records, newest first; the oldest
 * are evicted when it is full. Nothing is persisted.
 */
@Service
public class DecisionLog {

    private static final Logger log = LoggerFactory.getLogger(DecisionLog.class);

    static final int RING_BUFFER_SIZE = 500;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    @EventListener
    public void onDecision(DecisionEvent event) {
        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(event.getOccurredAt())
                .category(event.getCategory())
                .message(event.getMessage())
                .context(event.getContext())
                .build();
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.pollLast();
        }
        log.info("[{}] {} | {}", event.getCategory(), event.getMessage(), event.getContext());
    }

    /** Most recent decisions first, at most {@code limit}. */
    public List<DecisionRecord> getRecent(int limit) {
        return ringBuffer.stream().limit(Math.max(0, limit)).toList();
    }

    public int size() {
        return ringBuffer.size();
    }

    public void clear() {
        ringBuffer.clear();
    }
}
