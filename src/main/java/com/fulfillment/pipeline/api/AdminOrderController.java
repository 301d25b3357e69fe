package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.core.OrderService;
import com.fulfillment.pipeline.core.RefundOrchestrator;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator tooling for orders the pipeline could not finish on its own.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/orders")
@RequiredArgsConstructor
@Tag(name = "Operations", description = "Manual refund resolution and pipeline re-dispatch")
public class AdminOrderController {

    private final OrderStore orderStore;
    private final OrderService orderService;
    private final RefundOrchestrator refundOrchestrator;

    @GetMapping("/refund-pending")
    @Operation(summary = "Orders awaiting a manual refund", description = "Failed orders whose automatic refund failed, oldest first.")
    public ResponseEntity<List<OrderStatusResponseDto>> refundPending() {
        return ResponseEntity.ok(orderStore.findRefundPending().stream()
                .map(OrderStatusResponseDto::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/{orderId}/refund-resolved")
    @Operation(summary = "Record a manual refund", description = "Moves a refund-pending order to refunded and notifies the user.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order refunded"),
            @ApiResponse(responseCode = "400", description = "Order is not awaiting a manual refund"),
            @ApiResponse(responseCode = "404", description = "Unknown order id")
    })
    public ResponseEntity<OrderStatusResponseDto> refundResolved(@PathVariable String orderId,
                                                                 @Valid @RequestBody ResolveRefundRequestDto dto) {
        TransitionOutcome outcome = refundOrchestrator.resolveManually(orderId, dto.getOperator(), dto.getProviderRefundId());
        return ResponseEntity.ok(OrderStatusResponseDto.from(outcome.getOrder()));
    }

    @PostMapping("/{orderId}/resume")
    @Operation(summary = "Re-dispatch a paid or generating order's pipeline")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Dispatched"),
            @ApiResponse(responseCode = "400", description = "Order is not in paid or generating"),
            @ApiResponse(responseCode = "404", description = "Unknown order id")
    })
    public ResponseEntity<OrderStatusResponseDto> resume(@PathVariable String orderId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(OrderStatusResponseDto.from(orderService.resume(orderId)));
    }
}
