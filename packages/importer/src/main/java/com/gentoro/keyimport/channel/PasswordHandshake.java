package com.gentoro.keyimport.channel;

import com.gentoro.keyimport.model.PasswordRequest;
import com.gentoro.keyimport.model.PasswordResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pair of single-slot queues carrying one password round trip at a time.
 *
 * <p>The worker offers a {@link PasswordRequest} and then blocks in {@link
 * PasswordResponseSource#awaitResponse(Duration)}. The consumer polls requests and answers with
 * {@link #offerResponse(PasswordResponse)}, which never blocks: a full response slot means the
 * worker has not picked up the previous answer and the new one is refused.
 */
public final class PasswordHandshake implements PasswordRequestSink, PasswordResponseSource {
  private final BlockingQueue<PasswordRequest> requests = new ArrayBlockingQueue<>(1);
  private final BlockingQueue<PasswordResponse> responses = new ArrayBlockingQueue<>(1);

  @Override
  public boolean offerRequest(PasswordRequest request) {
    return requests.offer(Objects.requireNonNull(request, "request"));
  }

  @Override
  public Optional<PasswordResponse> awaitResponse(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(responses.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  /** Consumer side: next pending request, or empty after {@code timeout}. */
  public Optional<PasswordRequest> pollRequest(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(requests.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  /** Consumer side: non-blocking send. */
  public boolean offerResponse(PasswordResponse response) {
    return responses.offer(Objects.requireNonNull(response, "response"));
  }

  /** Request half only, so the worker cannot reach the consumer operations. */
  public PasswordRequestSink requestSink() {
    return this::offerRequest;
  }

  public PasswordResponseSource responseSource() {
    return this::awaitResponse;
  }

  public boolean hasPendingRequest() {
    return !requests.isEmpty();
  }

  public boolean hasPendingResponse() {
    return !responses.isEmpty();
  }

  /** Drop anything still queued in either direction. */
  public void clear() {
    requests.clear();
    responses.clear();
  }
}
