package com.example.eventcore.application.domain.order.aggregate;

import java.util.List;

import com.example.eventcore.application.domain.aggregate.AggregateDefinition;
import com.example.eventcore.application.domain.order.aggregate.vo.OrderStatus;
import com.example.eventcore.application.domain.order.command.AddItem;
import com.example.eventcore.application.domain.order.command.CancelOrder;
import com.example.eventcore.application.domain.order.command.ConfirmOrder;
import com.example.eventcore.application.domain.order.command.CreateOrder;
import com.example.eventcore.application.domain.order.command.RemoveItem;
import com.example.eventcore.application.domain.order.event.ItemAdded;
import com.example.eventcore.application.domain.order.event.ItemRemoved;
import com.example.eventcore.application.domain.order.event.OrderCancelled;
import com.example.eventcore.application.domain.order.event.OrderConfirmed;
import com.example.eventcore.application.domain.order.event.OrderCreated;
import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.shared.exception.DomainValidationException;

/**
 * 訂單聚合 (Order Aggregate)
 *
 * <p>
 * 業務規則：
 * <ul>
 * <li>訂單只能建立一次</li>
 * <li>只有 OPEN 狀態可以增減商品，同一 SKU 單價必須一致</li>
 * <li>確認時至少要有一項商品；重複確認視為冪等</li>
 * <li>OPEN 或 CONFIRMED 都可以取消；重複取消視為冪等</li>
 * </ul>
 * </p>
 */
public final class OrderAggregate {

	private OrderAggregate() {
	}

	public static AggregateDefinition<OrderState> definition() {
		return AggregateDefinition.builder(OrderEventTypes.STREAM_TYPE, OrderState.class, OrderState::initial)
				.onEvent(OrderEventTypes.ORDER_CREATED, 1, OrderCreated.class, OrderState::withCreated)
				.onEvent(OrderEventTypes.ITEM_ADDED, ItemAdded.SCHEMA_VERSION, ItemAdded.class,
						OrderState::withItemAdded)
				.onEvent(OrderEventTypes.ITEM_REMOVED, 1, ItemRemoved.class, OrderState::withItemRemoved)
				.onEvent(OrderEventTypes.ORDER_CONFIRMED, 1, OrderConfirmed.class, OrderState::withConfirmed)
				.onEvent(OrderEventTypes.ORDER_CANCELLED, 1, OrderCancelled.class, OrderState::withCancelled)
				.onCommand(CreateOrder.class, OrderAggregate::create)
				.onCommand(AddItem.class, OrderAggregate::addItem)
				.onCommand(RemoveItem.class, OrderAggregate::removeItem)
				.onCommand(ConfirmOrder.class, OrderAggregate::confirm)
				.onCommand(CancelOrder.class, OrderAggregate::cancel)
				.build();
	}

	static List<Object> create(OrderState state, CreateOrder command) {
		if (state.status() != OrderStatus.NONE) {
			throw new DomainValidationException("訂單已存在");
		}
		if (command.customerId() == null || command.customerId().isBlank()) {
			throw new DomainValidationException("customerId 不可為空");
		}
		return List.of(new OrderCreated(command.customerId()));
	}

	static List<Object> addItem(OrderState state, AddItem command) {
		requireOpen(state);
		if (command.sku() == null || command.sku().isBlank()) {
			throw new DomainValidationException("sku 不可為空");
		}
		if (command.quantity() <= 0) {
			throw new DomainValidationException("數量必須大於 0");
		}
		if (command.unitPriceCents() < 0) {
			throw new DomainValidationException("單價不可為負數");
		}
		state.line(command.sku()).ifPresent(line -> {
			if (line.unitPriceCents() != command.unitPriceCents()) {
				throw new DomainValidationException("SKU " + command.sku() + " 單價與既有明細不一致");
			}
		});
		return List.of(new ItemAdded(command.sku(), command.quantity(), command.unitPriceCents()));
	}

	static List<Object> removeItem(OrderState state, RemoveItem command) {
		requireOpen(state);
		OrderLine line = state.line(command.sku())
				.orElseThrow(() -> new DomainValidationException("訂單中沒有 SKU " + command.sku()));
		return List.of(new ItemRemoved(line.sku(), line.quantity(), line.unitPriceCents()));
	}

	static List<Object> confirm(OrderState state, ConfirmOrder command) {
		if (state.status() == OrderStatus.CONFIRMED) {
			requireTotal(state, command);
			return List.of();
		}
		requireOpen(state);
		if (state.lines().isEmpty()) {
			throw new DomainValidationException("空訂單無法確認");
		}
		requireTotal(state, command);
		return List.of(new OrderConfirmed(state.totalCents()));
	}

	private static void requireTotal(OrderState state, ConfirmOrder command) {
		Long expected = command.expectedTotalCents();
		if (expected != null && expected != state.totalCents()) {
			throw new DomainValidationException(
					"訂單總額已變更: 預期 " + expected + "，目前 " + state.totalCents());
		}
	}

	static List<Object> cancel(OrderState state, CancelOrder command) {
		if (state.status() == OrderStatus.CANCELLED) {
			return List.of();
		}
		if (state.status() == OrderStatus.NONE) {
			throw new DomainValidationException("訂單不存在");
		}
		return List.of(new OrderCancelled(command.reason()));
	}

	private static void requireOpen(OrderState state) {
		if (state.status() != OrderStatus.OPEN) {
			throw new DomainValidationException("訂單狀態為 " + state.status() + "，無法修改");
		}
	}
}
