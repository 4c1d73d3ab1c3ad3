package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.BulkOrderRequest;
import com.mealshift.orderservice.dto.BulkOrderResponse;
import com.mealshift.orderservice.dto.CancelOrderRequest;
import com.mealshift.orderservice.dto.CollectByCodeRequest;
import com.mealshift.orderservice.dto.CollectOrderRequest;
import com.mealshift.orderservice.dto.OrderRequest;
import com.mealshift.orderservice.dto.OrderResponse;
import com.mealshift.orderservice.dto.OrderStatisticsResponse;
import com.mealshift.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.createOrder(orderRequest, jwt);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/bulk")
    public ResponseEntity<BulkOrderResponse> bulkCreateOrders(
            @Valid @RequestBody BulkOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.bulkCreateOrders(request, jwt));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> getOrders(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) UUID personId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getOrders(from, to, personId, jwt));
    }

    @GetMapping("/stats")
    public ResponseEntity<OrderStatisticsResponse> getStatistics(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getStatistics(from, to, jwt));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.getOrderById(orderId, jwt);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{orderId}/collect")
    public ResponseEntity<OrderResponse> collectOrder(
            @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) CollectOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.collectOrder(orderId, request, jwt);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/collect-by-code")
    public ResponseEntity<OrderResponse> collectByPickupCode(
            @Valid @RequestBody CollectByCodeRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.collectByPickupCode(request, jwt);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) CancelOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.cancelOrder(orderId, request, jwt);
        return ResponseEntity.ok(response);
    }
}
