package com.nearbylite.engine;

public interface UpstreamListener<T> {

    void onNext(T value);

    default void onError(Throwable error) {}

    default void onComplete() {}
}
