package com.flamingo.ai.redline.service.admission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.redline.exception.AdmissionTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AdmissionController")
class AdmissionControllerTest {

  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldTrackOutstandingPermits_whenAcquiredAndReleased() {
    AdmissionController controller = AdmissionController.of(2, Duration.ofMillis(100));

    AdmissionPermit first = controller.acquire();
    AdmissionPermit second = controller.acquire();

    assertThat(controller.capacity()).isEqualTo(2);
    assertThat(controller.outstanding()).isEqualTo(2);

    first.release();
    second.release();

    assertThat(controller.outstanding()).isZero();
  }

  @Test
  void shouldIgnoreSecondRelease_whenPermitReleasedTwice() {
    AdmissionController controller = AdmissionController.of(1, Duration.ofMillis(100));
    AdmissionPermit permit = controller.acquire();

    permit.release();
    permit.release();

    assertThat(permit.isReleased()).isTrue();
    assertThat(controller.outstanding()).isZero();
    // A double release must not have minted an extra slot.
    AdmissionPermit again = controller.acquire();
    assertThatThrownBy(controller::acquire).isInstanceOf(AdmissionTimeoutException.class);
    again.release();
  }

  @Test
  void shouldTimeOut_whenNoSlotFreesUp() {
    AdmissionController controller = AdmissionController.of(1, Duration.ofMillis(50));
    AdmissionPermit held = controller.acquire();

    assertThatThrownBy(controller::acquire)
        .isInstanceOf(AdmissionTimeoutException.class)
        .hasMessageContaining("No editing slot available");

    held.release();
    assertThat(controller.outstanding()).isZero();
  }

  @Test
  void shouldAdmitWaiter_whenSlotReleasedBeforeTimeout() throws Exception {
    AdmissionController controller = AdmissionController.of(1, Duration.ofSeconds(5));
    AdmissionPermit held = controller.acquire();

    Future<AdmissionPermit> waiter = executor.submit(controller::acquire);
    Thread.sleep(100);
    assertThat(waiter.isDone()).isFalse();

    held.release();
    AdmissionPermit admitted = waiter.get(2, TimeUnit.SECONDS);

    assertThat(controller.outstanding()).isEqualTo(1);
    admitted.release();
  }

  @Test
  void shouldHoldExtraRequest_untilOneOfFullCapacityReleases() throws Exception {
    int capacity = 3;
    AdmissionController controller = AdmissionController.of(capacity, Duration.ofSeconds(5));
    List<AdmissionPermit> held = new ArrayList<>();
    for (int i = 0; i < capacity; i++) {
      held.add(controller.acquire());
    }

    Future<AdmissionPermit> extra = executor.submit(controller::acquire);
    Thread.sleep(150);
    assertThat(extra.isDone()).isFalse();
    assertThat(controller.outstanding()).isEqualTo(capacity);

    held.remove(0).release();
    AdmissionPermit admitted = extra.get(2, TimeUnit.SECONDS);

    assertThat(controller.outstanding()).isEqualTo(capacity);
    admitted.release();
    held.forEach(AdmissionPermit::release);
    assertThat(controller.outstanding()).isZero();
  }

  @Test
  void shouldAdmitWaiters_inArrivalOrder() throws Exception {
    AdmissionController controller = AdmissionController.of(1, Duration.ofSeconds(5));
    AdmissionPermit held = controller.acquire();
    List<Integer> admitted = Collections.synchronizedList(new ArrayList<>());
    List<Future<?>> waiters = new ArrayList<>();

    for (int i = 0; i < 4; i++) {
      int arrival = i;
      waiters.add(
          executor.submit(
              () -> {
                AdmissionPermit permit = controller.acquire();
                admitted.add(arrival);
                permit.release();
                return null;
              }));
      // Let each waiter park before the next one arrives.
      Thread.sleep(100);
    }
    assertThat(admitted).isEmpty();

    held.release();
    for (Future<?> waiter : waiters) {
      waiter.get(5, TimeUnit.SECONDS);
    }

    assertThat(admitted).containsExactly(0, 1, 2, 3);
    assertThat(controller.outstanding()).isZero();
  }

  @Test
  void shouldNeverExceedCapacity_whenManyRequestsContend() throws Exception {
    int capacity = 4;
    int requests = capacity + 1;
    AdmissionController controller = AdmissionController.of(capacity, Duration.ofSeconds(5));
    CountDownLatch start = new CountDownLatch(1);
    List<Integer> observed = new ArrayList<>();
    List<Future<?>> futures = new ArrayList<>();

    for (int i = 0; i < requests; i++) {
      futures.add(
          executor.submit(
              () -> {
                start.await();
                AdmissionPermit permit = controller.acquire();
                try {
                  synchronized (observed) {
                    observed.add(controller.outstanding());
                  }
                  Thread.sleep(50);
                } finally {
                  permit.release();
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(5, TimeUnit.SECONDS);
    }

    assertThat(observed).hasSize(requests).allSatisfy(n -> assertThat(n).isLessThanOrEqualTo(capacity));
    assertThat(controller.outstanding()).isZero();
  }
}
