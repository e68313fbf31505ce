package com.tradeguard.api.controller;

import com.tradeguard.domain.model.Order;
import com.tradeguard.oms.ExecutionVenue;
import com.tradeguard.oms.OrderCancellationService;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Working orders on the active venue.
 *
 * <ul>
 *   <li>GET /api/orders/open -- orders not yet terminal</li>
 *   <li>DELETE /api/orders/{orderId} -- cancel one order, bounded by the cancel deadline</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final ExecutionVenue executionVenue;
    private final OrderCancellationService orderCancellationService;

    public OrderController(ExecutionVenue executionVenue, OrderCancellationService orderCancellationService) {
        this.executionVenue = executionVenue;
        this.orderCancellationService = orderCancellationService;
    }

    @GetMapping("/open")
    public ResponseEntity<List<Order>> openOrders() {
        return ResponseEntity.ok(executionVenue.openOrders());
    }

    @DeleteMapping("/{orderId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String orderId) {
        log.info("Cancel requested for order {}", orderId);
        boolean canceled = orderCancellationService.cancel(orderId);
        return ResponseEntity.ok(Map.of("orderId", orderId, "canceled", canceled));
    }
}
