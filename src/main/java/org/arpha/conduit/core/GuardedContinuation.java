package org.arpha.conduit.core;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.http.pipeline.HttpRequest;
import org.arpha.conduit.http.pipeline.Next;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Continuation owned by a single handler invocation. The first call wins: after it, the
 * invocation has either proceeded or failed, and every later call is dropped and logged.
 */
@Slf4j
final class GuardedContinuation implements Next {

    enum State {
        PENDING,
        PROCEEDED,
        FAILED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private final String handler;
    private final HttpRequest request;
    private final Next downstream;

    GuardedContinuation(String handler, HttpRequest request, Next downstream) {
        this.handler = handler;
        this.request = request;
        this.downstream = downstream;
    }

    @Override
    public void proceed() {
        if (state.compareAndSet(State.PENDING, State.PROCEEDED)) {
            downstream.proceed();
        } else {
            log.warn("{} called next again for {} after it had {}; ignored", handler, request, state.get());
        }
    }

    @Override
    public void fail(Throwable error) {
        if (state.compareAndSet(State.PENDING, State.FAILED)) {
            downstream.fail(error);
        } else {
            log.error("{} failed for {} after it had {}; error not forwarded", handler, request, state.get(), error);
        }
    }

    boolean isPending() {
        return state.get() == State.PENDING;
    }

    State state() {
        return state.get();
    }

}
