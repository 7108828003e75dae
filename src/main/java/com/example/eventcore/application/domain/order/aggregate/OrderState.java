package com.example.eventcore.application.domain.order.aggregate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.example.eventcore.application.domain.order.aggregate.vo.OrderStatus;
import com.example.eventcore.application.domain.order.event.ItemAdded;
import com.example.eventcore.application.domain.order.event.ItemRemoved;
import com.example.eventcore.application.domain.order.event.OrderCancelled;
import com.example.eventcore.application.domain.order.event.OrderConfirmed;
import com.example.eventcore.application.domain.order.event.OrderCreated;

/**
 * 訂單聚合狀態 (不可變)
 *
 * <p>
 * 每個 {@code with...} 方法對應一個事件，回傳套用後的新狀態。
 * </p>
 */
public record OrderState(String customerId, OrderStatus status, List<OrderLine> lines, String cancelReason) {

	public OrderState {
		lines = lines == null ? List.of() : List.copyOf(lines);
	}

	public static OrderState initial() {
		return new OrderState(null, OrderStatus.NONE, List.of(), null);
	}

	public long totalCents() {
		return lines.stream().mapToLong(OrderLine::subtotalCents).sum();
	}

	public int itemCount() {
		return lines.stream().mapToInt(OrderLine::quantity).sum();
	}

	public Optional<OrderLine> line(String sku) {
		return lines.stream().filter(l -> l.sku().equals(sku)).findFirst();
	}

	public OrderState withCreated(OrderCreated event) {
		return new OrderState(event.customerId(), OrderStatus.OPEN, List.of(), null);
	}

	public OrderState withItemAdded(ItemAdded event) {
		List<OrderLine> updated = new ArrayList<>();
		boolean merged = false;
		for (OrderLine line : lines) {
			if (line.sku().equals(event.sku())) {
				updated.add(new OrderLine(line.sku(), line.quantity() + event.quantity(), line.unitPriceCents()));
				merged = true;
			} else {
				updated.add(line);
			}
		}
		if (!merged) {
			updated.add(new OrderLine(event.sku(), event.quantity(), event.unitPriceCents()));
		}
		return new OrderState(customerId, status, updated, cancelReason);
	}

	public OrderState withItemRemoved(ItemRemoved event) {
		List<OrderLine> updated = lines.stream().filter(l -> !l.sku().equals(event.sku())).toList();
		return new OrderState(customerId, status, updated, cancelReason);
	}

	public OrderState withConfirmed(OrderConfirmed event) {
		return new OrderState(customerId, OrderStatus.CONFIRMED, lines, null);
	}

	public OrderState withCancelled(OrderCancelled event) {
		return new OrderState(customerId, OrderStatus.CANCELLED, lines, event.reason());
	}
}
