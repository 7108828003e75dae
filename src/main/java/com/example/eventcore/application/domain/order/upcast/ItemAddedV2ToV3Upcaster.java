package com.example.eventcore.application.domain.order.upcast;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.domain.upcast.Upcaster;

/**
 * ItemAdded v2 → v3：單價由元 (小數) 改為分 (整數)
 */
public class ItemAddedV2ToV3Upcaster implements Upcaster {

	@Override
	public String eventType() {
		return OrderEventTypes.ITEM_ADDED;
	}

	@Override
	public int fromVersion() {
		return 2;
	}

	@Override
	public Map<String, Object> upcast(Map<String, Object> payload) {
		Object unitPrice = payload.remove("unitPrice");
		if (!(unitPrice instanceof Number)) {
			throw new IllegalArgumentException("ItemAdded v2 缺少 unitPrice 欄位");
		}
		long cents = new BigDecimal(unitPrice.toString()).movePointRight(2).setScale(0, RoundingMode.HALF_UP)
				.longValueExact();
		payload.put("unitPriceCents", cents);
		return payload;
	}
}
