package com.mooncell.relay.web;

import com.mooncell.relay.core.batch.BatchController;
import com.mooncell.relay.core.batch.BatchProgress;
import com.mooncell.relay.core.batch.BatchRequest;
import com.mooncell.relay.core.batch.BatchTooLargeException;
import com.mooncell.relay.core.download.ReferenceResolver;
import com.mooncell.relay.core.history.TaskHistoryStore;
import com.mooncell.relay.core.model.BatchJob;
import com.mooncell.relay.core.model.BatchState;
import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.task.QueueFullException;
import com.mooncell.relay.core.task.TaskQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelayControllerTest {

    @Mock
    private TaskQueue taskQueue;
    @Mock
    private BatchController batchController;
    @Mock
    private TaskHistoryStore historyStore;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        RelayController controller = new RelayController(taskQueue, batchController, historyStore, new ReferenceResolver());
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void relayIsAcceptedAndQueued() {
        client.post().uri("/v1/relay")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("requester", "alice", "link", "https://t.me/durov/5"))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.state").isEqualTo("PENDING")
                .jsonPath("$.requester").isEqualTo("alice");

        ArgumentCaptor<RelayTask> task = ArgumentCaptor.forClass(RelayTask.class);
        verify(taskQueue).submit(task.capture());
        assertThat(task.getValue().getReference().getChatId()).isEqualTo("durov");
    }

    @Test
    void malformedLinkIsRejectedBeforeQueueing() {
        client.post().uri("/v1/relay")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("requester", "alice", "link", "https://example.com/x"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REFERENCE");

        verifyNoInteractions(taskQueue);
    }

    @Test
    void missingRequesterIsBadRequest() {
        client.post().uri("/v1/relay")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("link", "https://t.me/durov/5"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("BAD_REQUEST");
    }

    @Test
    void fullQueueAnswersTooManyRequests() {
        doThrow(new QueueFullException(500)).when(taskQueue).submit(any());

        client.post().uri("/v1/relay")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("requester", "alice", "link", "https://t.me/durov/5"))
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectBody()
                .jsonPath("$.error").isEqualTo("QUEUE_FULL");
    }

    @Test
    void unknownTaskIsNotFound() {
        when(taskQueue.find("nope")).thenReturn(Optional.empty());

        client.get().uri("/v1/tasks/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    void batchIsStarted() {
        BatchJob job = new BatchJob("job-1", "alice", List.of("https://t.me/durov/1", "https://t.me/durov/2"),
                0, 0, 0, BatchState.ACTIVE, Instant.now());
        when(batchController.start(any(BatchRequest.class))).thenReturn(job);

        client.post().uri("/v1/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("owner", "alice", "link", "https://t.me/durov/1", "count", 2))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.id").isEqualTo("job-1")
                .jsonPath("$.total").isEqualTo(2);

        ArgumentCaptor<BatchRequest> request = ArgumentCaptor.forClass(BatchRequest.class);
        verify(batchController).start(request.capture());
        assertThat(request.getValue().isRange()).isTrue();
        assertThat(request.getValue().getCount()).isEqualTo(2);
    }

    @Test
    void oversizedBatchIsBadRequest() {
        when(batchController.start(any(BatchRequest.class))).thenThrow(new BatchTooLargeException(150, 100));

        client.post().uri("/v1/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("owner", "alice", "link", "https://t.me/durov/1", "count", 150))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("BATCH_TOO_LARGE");
    }

    @Test
    void progressIsStreamedAsServerSentEvents() {
        BatchProgress progress = new BatchProgress("job-1", BatchState.ACTIVE, 10, 5, 2, 1, 2, Instant.now());
        when(batchController.progress("job-1")).thenReturn(Flux.just(progress));

        Flux<String> body = client.get().uri("/v1/batches/job-1/progress")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(String.class)
                .getResponseBody();

        StepVerifier.create(body)
                .expectNextMatches(event -> event.contains("\"jobId\":\"job-1\"") && event.contains("\"succeeded\":2"))
                .verifyComplete();
    }
}
