package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.core.OrderService;
import com.fulfillment.pipeline.domain.CreateOrderCommand;
import com.fulfillment.pipeline.domain.PaymentInitiation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Order creation and status for the front-end.
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
@Tag(name = "Orders", description = "Create orders and query their fulfillment status")
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @Operation(
            summary = "Create order",
            description = "Creates a pending_payment order priced from the product catalog and returns the payment "
                    + "initiation reference for the checkout link. Free products are confirmed immediately.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Order created",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = CreateOrderResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed or required product input missing")
    })
    public ResponseEntity<CreateOrderResponseDto> create(@Valid @RequestBody CreateOrderRequestDto dto) {
        PaymentInitiation initiation = orderService.createOrder(CreateOrderCommand.builder()
                .userRef(dto.getUserRef())
                .productKind(dto.getProductKind())
                .input(dto.getInput())
                .affiliateCode(dto.getAffiliateCode())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(CreateOrderResponseDto.from(initiation));
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get order status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current snapshot",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = OrderStatusResponseDto.class))),
            @ApiResponse(responseCode = "404", description = "Unknown order id")
    })
    public ResponseEntity<OrderStatusResponseDto> get(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderStatusResponseDto.from(orderService.getOrderStatus(orderId)));
    }
}
