package com.tradingagent.strategy.feed;

import com.tradingagent.domain.model.TradeSignal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Hand-off point between an external trade listener and the signal-following strategy. */
@Component
public class SignalChannel {

    private static final Logger log = LoggerFactory.getLogger(SignalChannel.class);

    private final LinkedBlockingQueue<TradeSignal> signals = new LinkedBlockingQueue<>();

    public void publish(TradeSignal signal) {
        signals.offer(signal);
        log.debug("Signal from {} on {} ({} pending)", signal.getSource(), signal.getTickerSelector(), signals.size());
    }

    /**
     * Waits up to {@code timeout} for the first signal, then takes everything else pending.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public List<TradeSignal> await(Duration timeout) throws InterruptedException {
        List<TradeSignal> batch = new ArrayList<>();
        TradeSignal first = signals.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) {
            return batch;
        }
        batch.add(first);
        signals.drainTo(batch);
        return batch;
    }

    /** Takes everything pending without waiting. */
    public List<TradeSignal> drain() {
        List<TradeSignal> batch = new ArrayList<>();
        signals.drainTo(batch);
        return batch;
    }

    public int size() {
        return signals.size();
    }
}
