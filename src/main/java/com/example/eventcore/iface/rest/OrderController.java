package com.example.eventcore.iface.rest;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.eventcore.application.domain.order.command.AddItem;
import com.example.eventcore.application.domain.order.command.CancelOrder;
import com.example.eventcore.application.domain.order.command.ConfirmOrder;
import com.example.eventcore.application.domain.order.command.CreateOrder;
import com.example.eventcore.application.domain.order.command.RemoveItem;
import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.service.CommandResult;
import com.example.eventcore.application.service.CommandService;
import com.example.eventcore.application.service.OrderQueryService;
import com.example.eventcore.application.shared.projection.OrderSummaryView;
import com.example.eventcore.iface.dto.req.AddItemResource;
import com.example.eventcore.iface.dto.req.CancelOrderResource;
import com.example.eventcore.iface.dto.req.CreateOrderResource;
import com.example.eventcore.iface.dto.res.CommandResultResource;
import com.example.eventcore.iface.dto.res.OrderQueriedResource;
import com.example.eventcore.iface.filter.CorrelationIdFilter;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;

/**
 * 訂單指令與查詢控制器
 *
 * <p>
 * 指令同步執行，版本衝突與領域錯誤直接回應給呼叫端；{@code expectedVersion} 可選填，填入時採嚴格樂觀鎖。
 * 查詢走投影後的讀取模型，為最終一致。
 * </p>
 */
@RestController
@AllArgsConstructor
@RequestMapping("/orders")
public class OrderController {

	private final CommandService commandService;
	private final OrderQueryService queryService;

	@PostMapping
	public ResponseEntity<CommandResultResource> create(@Valid @RequestBody CreateOrderResource request) {
		String orderId = UUID.randomUUID().toString();
		CommandResult result = submit(orderId, new CreateOrder(request.getCustomerId()), null);
		return ResponseEntity.status(HttpStatus.CREATED).body(new CommandResultResource("201", "訂單已建立", result));
	}

	@PostMapping("/{id}/items")
	public ResponseEntity<CommandResultResource> addItem(@PathVariable String id,
			@Valid @RequestBody AddItemResource request, @RequestParam(required = false) Long expectedVersion) {
		AddItem command = new AddItem(request.getSku(), request.getQuantity(), request.getUnitPriceCents());
		return ok(submit(id, command, expectedVersion));
	}

	@DeleteMapping("/{id}/items/{sku}")
	public ResponseEntity<CommandResultResource> removeItem(@PathVariable String id, @PathVariable String sku,
			@RequestParam(required = false) Long expectedVersion) {
		return ok(submit(id, new RemoveItem(sku), expectedVersion));
	}

	@PostMapping("/{id}/confirm")
	public ResponseEntity<CommandResultResource> confirm(@PathVariable String id,
			@RequestParam(required = false) Long expectedVersion) {
		return ok(submit(id, new ConfirmOrder(), expectedVersion));
	}

	@PostMapping("/{id}/cancel")
	public ResponseEntity<CommandResultResource> cancel(@PathVariable String id,
			@RequestBody(required = false) CancelOrderResource request,
			@RequestParam(required = false) Long expectedVersion) {
		String reason = request == null ? null : request.getReason();
		return ok(submit(id, new CancelOrder(reason), expectedVersion));
	}

	@GetMapping("/{id}")
	public ResponseEntity<OrderQueriedResource> getOrder(@PathVariable String id) {
		return queryService.getOrderSummary(id)
				.map(view -> ResponseEntity.ok(new OrderQueriedResource("200", "查詢成功", view)))
				.orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
						.body(new OrderQueriedResource("404", "找不到訂單 (或尚未投影): " + id, null)));
	}

	@GetMapping
	public ResponseEntity<List<OrderSummaryView>> getOrdersByCustomer(@RequestParam String customerId) {
		return ResponseEntity.ok(queryService.getOrdersByCustomer(customerId));
	}

	private CommandResult submit(String orderId, Object command, Long expectedVersion) {
		return commandService.submit(OrderEventTypes.STREAM_TYPE, orderId, command,
				CorrelationIdFilter.currentMetadata(), expectedVersion);
	}

	private static ResponseEntity<CommandResultResource> ok(CommandResult result) {
		String message = result.isNoop() ? "狀態未變更" : "指令已執行";
		return ResponseEntity.ok(new CommandResultResource("200", message, result));
	}
}
