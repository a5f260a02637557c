package com.nearbylite.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hot {@link UpstreamSource} fed by callbacks: a platform location listener, a roster sync
 * callback, or a test. Values pushed while nobody is subscribed are dropped, except the most
 * recent one, which is replayed to each new subscriber.
 */
public final class PushSource<T> implements UpstreamSource<T> {

    private static final Logger log = LoggerFactory.getLogger(PushSource.class);

    private final String name;
    private final CopyOnWriteArrayList<UpstreamListener<? super T>> listeners = new CopyOnWriteArrayList<>();
    private volatile T latest;

    public PushSource(String name) {
        this.name = name;
    }

    @Override
    public Subscription subscribe(UpstreamListener<? super T> listener) {
        listeners.add(listener);
        T replay = latest;
        if (replay != null) {
            listener.onNext(replay);
        }
        return () -> listeners.remove(listener);
    }

    public void push(T value) {
        latest = value;
        for (var l : listeners) {
            l.onNext(value);
        }
    }

    public void fail(Throwable error) {
        log.debug("[{}] failing {} subscriber(s)", name, listeners.size(), error);
        for (var l : listeners) {
            l.onError(error);
        }
    }

    public void complete() {
        for (var l : listeners) {
            l.onComplete();
        }
    }

    public int subscriberCount() {
        return listeners.size();
    }

    public String name() {
        return name;
    }
}
