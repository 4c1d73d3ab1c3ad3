package com.mealshift.orderservice;

import com.mealshift.orderservice.dto.CancelOrderRequest;
import com.mealshift.orderservice.dto.OrderRequest;
import com.mealshift.orderservice.dto.OrderResponse;
import com.mealshift.orderservice.exception.OrderAlreadyFinalizedException;
import com.mealshift.orderservice.exception.OrderRejectedException;
import com.mealshift.orderservice.exception.RejectionReason;
import com.mealshift.orderservice.model.OrderStatus;
import com.mealshift.orderservice.model.OutboxEvent;
import com.mealshift.orderservice.model.Person;
import com.mealshift.orderservice.model.Shift;
import com.mealshift.orderservice.service.OrderService;
import com.mealshift.orderservice.support.TestJwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private OrderService orderService;

    private Person person;
    private Shift morning;
    private Jwt personJwt;

    @BeforeEach
    void setUp() {
        person = person(0);
        morning = shift("Morning", 8, 16);
        personJwt = TestJwts.forPerson(person.getId(), "USER");
    }

    @Test
    void concurrent_cancels_exactly_one_wins() throws Exception {
        OrderResponse order = orderService.createOrder(request(), personJwt);
        CancelOrderRequest cancel = new CancelOrderRequest();
        cancel.setReason("Changed plans");

        List<Outcome> outcomes = race(2, () -> orderService.cancelOrder(order.getId(), cancel, personJwt));

        assertThat(outcomes).filteredOn(o -> o.success).hasSize(1);
        assertThat(outcomes).filteredOn(o -> o.failure instanceof OrderAlreadyFinalizedException).hasSize(1);
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.CANCELLED);
        assertThat(outboxRepository.findAll())
                .extracting(OutboxEvent::getType)
                .containsOnlyOnce("order.cancelled");
    }

    @Test
    void concurrent_creates_for_same_date_keep_one_live_order() throws Exception {
        List<Outcome> outcomes = race(4, () -> orderService.createOrder(request(), personJwt));

        assertThat(outcomes).filteredOn(o -> o.success).hasSize(1);
        assertThat(outcomes).filteredOn(o -> !o.success)
                .allSatisfy(o -> assertThat(((OrderRejectedException) o.failure).getReason())
                        .isEqualTo(RejectionReason.DUPLICATE_FOR_DATE));
        assertThat(orderRepository.count()).isEqualTo(1);
    }

    private OrderRequest request() {
        OrderRequest request = new OrderRequest();
        request.setShiftId(morning.getId());
        request.setOrderDate(TODAY);
        return request;
    }

    private List<Outcome> race(int parallelism, Callable<?> call) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < parallelism; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();
            List<Outcome> outcomes = new ArrayList<>();
            for (Future<?> future : futures) {
                outcomes.add(outcome(future));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome outcome(Future<?> future) throws InterruptedException {
        try {
            future.get(30, TimeUnit.SECONDS);
            return new Outcome(true, null);
        } catch (ExecutionException e) {
            return new Outcome(false, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Racing call did not finish", e);
        }
    }

    private static final class Outcome {
        private final boolean success;
        private final Throwable failure;

        private Outcome(boolean success, Throwable failure) {
            this.success = success;
            this.failure = failure;
        }
    }
}
