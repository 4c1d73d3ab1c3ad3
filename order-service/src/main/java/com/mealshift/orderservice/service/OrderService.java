package com.mealshift.orderservice.service;

import com.mealshift.orderservice.dto.BulkOrderRequest;
import com.mealshift.orderservice.dto.BulkOrderResponse;
import com.mealshift.orderservice.dto.CancelOrderRequest;
import com.mealshift.orderservice.dto.CollectByCodeRequest;
import com.mealshift.orderservice.dto.CollectOrderRequest;
import com.mealshift.orderservice.dto.OrderRequest;
import com.mealshift.orderservice.dto.OrderResponse;
import com.mealshift.orderservice.dto.OrderStatisticsResponse;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface OrderService {

    OrderResponse createOrder(OrderRequest orderRequest, Jwt jwt);

    /**
     * Places each item as {@link #createOrder} would. A refused item does not stop the others;
     * it is reported with its rejection reason.
     */
    BulkOrderResponse bulkCreateOrders(BulkOrderRequest request, Jwt jwt);

    OrderResponse collectOrder(UUID orderId, CollectOrderRequest request, Jwt jwt);

    OrderResponse collectByPickupCode(CollectByCodeRequest request, Jwt jwt);

    OrderResponse cancelOrder(UUID orderId, CancelOrderRequest request, Jwt jwt);

    OrderResponse getOrderById(UUID orderId, Jwt jwt);

    List<OrderResponse> getOrders(LocalDate from, LocalDate to, UUID personId, Jwt jwt);

    OrderStatisticsResponse getStatistics(LocalDate from, LocalDate to, Jwt jwt);

    /**
     * Releases a person's open orders from today on, e.g. after they were restricted.
     *
     * @return number of orders cancelled
     */
    int cancelUpcomingOrders(UUID personId, String reason);

    /**
     * Releases open orders dated after the given day, e.g. after the booking horizon shrank.
     *
     * @return number of orders cancelled
     */
    int cancelOrdersAfter(LocalDate lastBookableDate, String reason);
}
