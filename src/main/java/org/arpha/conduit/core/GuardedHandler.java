package org.arpha.conduit.core;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.http.pipeline.HttpRequest;
import org.arpha.conduit.http.pipeline.HttpResponse;
import org.arpha.conduit.http.pipeline.Middleware;
import org.arpha.conduit.http.pipeline.Next;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Runs a handler so that whatever it raises, synchronously or through the stage it returns,
 * reaches {@code next.fail} exactly once and never escapes to the host.
 * <p>
 * The wrapper itself always completes synchronously from the host's point of view.
 */
@Slf4j
abstract class GuardedHandler implements Middleware {

    private final String label;

    protected GuardedHandler(String label) {
        this.label = label;
    }

    /**
     * @return a {@link CompletionStage} if the handler suspended, otherwise its plain result
     */
    protected abstract Object invoke(HttpRequest request, HttpResponse response, Next next) throws Throwable;

    /**
     * Called once the handler finished without error, with its result or the value its stage completed with.
     */
    protected void completed(Object value, HttpRequest request, HttpResponse response, GuardedContinuation next) {
    }

    @Override
    public final CompletionStage<?> handle(HttpRequest request, HttpResponse response, Next next) {
        GuardedContinuation continuation = new GuardedContinuation(label, request, next);
        Object result;
        try {
            result = invoke(request, response, continuation);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.debug("{} threw for {}", label, request, e);
            continuation.fail(unwrap(e));
            return null;
        }

        if (result instanceof CompletionStage) {
            ((CompletionStage<?>) result).whenComplete((value, error) -> {
                if (error != null) {
                    log.debug("{} failed asynchronously for {}", label, request, error);
                    continuation.fail(unwrap(error));
                } else {
                    settle(value, request, response, continuation);
                }
            });
        } else {
            settle(result, request, response, continuation);
        }
        return null;
    }

    private void settle(Object value, HttpRequest request, HttpResponse response, GuardedContinuation continuation) {
        try {
            completed(value, request, response, continuation);
        } catch (RuntimeException e) {
            continuation.fail(e);
        }
    }

    String label() {
        return label;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

}
