package com.example.eventcore.application.domain.order.event;

/**
 * Order 事件型別名稱，寫入日誌後不可更改
 */
public final class OrderEventTypes {

	public static final String STREAM_TYPE = "Order";

	public static final String ORDER_CREATED = "OrderCreated";
	public static final String ITEM_ADDED = "ItemAdded";
	public static final String ITEM_REMOVED = "ItemRemoved";
	public static final String ORDER_CONFIRMED = "OrderConfirmed";
	public static final String ORDER_CANCELLED = "OrderCancelled";

	private OrderEventTypes() {
	}
}
