package com.example.eventcore.application.domain.order.upcast;

import java.util.Map;

import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.domain.upcast.Upcaster;

/**
 * ItemAdded v1 → v2：補上數量 1，price 改名為 unitPrice
 */
public class ItemAddedV1ToV2Upcaster implements Upcaster {

	@Override
	public String eventType() {
		return OrderEventTypes.ITEM_ADDED;
	}

	@Override
	public int fromVersion() {
		return 1;
	}

	@Override
	public Map<String, Object> upcast(Map<String, Object> payload) {
		Object price = payload.remove("price");
		if (!(price instanceof Number)) {
			throw new IllegalArgumentException("ItemAdded v1 缺少 price 欄位");
		}
		payload.put("quantity", 1);
		payload.put("unitPrice", price);
		return payload;
	}
}
