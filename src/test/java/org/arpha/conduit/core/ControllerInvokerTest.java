package org.arpha.conduit.core;

import org.arpha.conduit.container.DefaultContainer;
import org.arpha.conduit.exception.RegistrationException;
import org.arpha.conduit.exception.SilentCompletionException;
import org.arpha.conduit.http.annotation.PathParam;
import org.arpha.conduit.http.annotation.QueryParam;
import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.HttpRequest;
import org.arpha.conduit.http.pipeline.HttpResponse;
import org.arpha.conduit.http.pipeline.Middleware;
import org.arpha.conduit.http.pipeline.Next;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ControllerInvokerTest {

    private final DefaultContainer container = new DefaultContainer();
    private final Next next = mock(Next.class);
    private final HttpResponse response = new HttpResponse();

    private Middleware wrap(String action, SilentCompletionPolicy policy) {
        return new ControllerInvoker(container, policy).wrap(SampleController.class, action);
    }

    private void invoke(String action, SilentCompletionPolicy policy, HttpRequest request) throws Exception {
        wrap(action, policy).handle(request, response, next);
    }

    private void invoke(String action, SilentCompletionPolicy policy) throws Exception {
        invoke(action, policy, HttpRequest.of(HttpMethod.GET, "/"));
    }

    @Nested
    @DisplayName("Action results")
    class Results {

        @Test
        void returnedValue_isSentAsJson() throws Exception {
            invoke("value", SilentCompletionPolicy.IGNORE);

            assertThat(response.isCommitted()).isTrue();
            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getBodyAsString()).isEqualTo("{\"id\":7}");
            verifyNoInteractions(next);
        }

        @Test
        void valueOfReturnedStage_isSent() throws Exception {
            invoke("asyncValue", SilentCompletionPolicy.IGNORE);

            assertThat(response.completion().get().getBodyAsString()).isEqualTo("async");
        }

        @Test
        void writtenResponse_isLeftAlone() throws Exception {
            invoke("writes", SilentCompletionPolicy.FORWARD_ERROR);

            assertThat(response.getStatus()).isEqualTo(201);
            assertThat(response.getBodyAsString()).isEqualTo("created");
            verifyNoInteractions(next);
        }

        @Test
        void actionCallingNext_isNotTreatedAsSilent() throws Exception {
            invoke("delegates", SilentCompletionPolicy.FORWARD_ERROR);

            verify(next).proceed();
            verify(next, never()).fail(any());
            assertThat(response.isCommitted()).isFalse();
        }

        @Test
        void checkedExceptionOfAction_isForwardedUnwrapped() throws Exception {
            invoke("throwsChecked", SilentCompletionPolicy.NO_CONTENT);

            ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
            verify(next).fail(error.capture());
            assertThat(error.getValue()).isInstanceOf(IOException.class).hasMessage("disk gone");
            assertThat(response.isCommitted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Silent completion")
    class SilentCompletion {

        @Test
        void noContent_commits204() throws Exception {
            invoke("silent", SilentCompletionPolicy.NO_CONTENT);

            assertThat(response.getStatus()).isEqualTo(204);
            assertThat(response.getBody()).isEmpty();
        }

        @Test
        void forwardError_failsContinuation() throws Exception {
            invoke("silent", SilentCompletionPolicy.FORWARD_ERROR);

            verify(next).fail(any(SilentCompletionException.class));
            assertThat(response.isCommitted()).isFalse();
        }

        @Test
        void ignore_leavesRequestOpen() throws Exception {
            invoke("silentAsync", SilentCompletionPolicy.IGNORE);

            verifyNoInteractions(next);
            assertThat(response.isCommitted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Argument binding")
    class Binding {

        @Test
        void pathAndQueryParams_areBound() throws Exception {
            HttpRequest request = HttpRequest.of(HttpMethod.GET, "/users/42?fields=name");
            request.setPathParams(Map.of("id", "42"));

            invoke("params", SilentCompletionPolicy.IGNORE, request);

            assertThat(response.getBodyAsString()).isEqualTo("42:name");
        }

        @Test
        void missingAction_isRejectedAtBuild() {
            assertThatThrownBy(() -> wrap("nope", SilentCompletionPolicy.NO_CONTENT))
                    .isInstanceOf(RegistrationException.class)
                    .hasMessageContaining("has no action nope");
        }

        @Test
        void overloadedAction_isRejectedAtBuild() {
            assertThatThrownBy(() -> wrap("overloaded", SilentCompletionPolicy.NO_CONTENT))
                    .isInstanceOf(RegistrationException.class)
                    .hasMessageContaining("overloaded");
        }

        @Test
        void unbindableParameter_isRejectedAtBuild() {
            assertThatThrownBy(() -> wrap("unbindable", SilentCompletionPolicy.NO_CONTENT))
                    .isInstanceOf(RegistrationException.class)
                    .hasMessageContaining("Cannot bind parameter");
        }
    }

    public static class SampleController {

        public Map<String, Integer> value() {
            return Map.of("id", 7);
        }

        public CompletionStage<String> asyncValue() {
            return CompletableFuture.supplyAsync(() -> "async");
        }

        public void writes(HttpResponse response) {
            response.status(201).send("created");
        }

        public void delegates(Next next) {
            next.proceed();
        }

        public void throwsChecked() throws IOException {
            throw new IOException("disk gone");
        }

        public void silent(HttpRequest request) {
        }

        public CompletionStage<Void> silentAsync() {
            return CompletableFuture.completedFuture(null);
        }

        public String params(@PathParam("id") String id, @QueryParam("fields") String fields) {
            return id + ":" + fields;
        }

        public void overloaded() {
        }

        public void overloaded(HttpRequest request) {
        }

        public void unbindable(Integer count) {
        }
    }

}
