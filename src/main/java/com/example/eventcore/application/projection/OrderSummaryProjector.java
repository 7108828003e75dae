package com.example.eventcore.application.projection;

import java.util.Optional;

import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.domain.order.event.ItemAdded;
import com.example.eventcore.application.domain.order.event.ItemRemoved;
import com.example.eventcore.application.domain.order.event.OrderCreated;
import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.port.OrderSummaryRepositoryPort;
import com.example.eventcore.application.shared.exception.SchemaUpcastException;
import com.example.eventcore.application.shared.projection.OrderSummaryView;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 訂單摘要投影：狀態、商品件數與總額
 */
@Slf4j
@RequiredArgsConstructor
public class OrderSummaryProjector implements ProjectionHandler {

	public static final String NAME = "order-summary";

	private final OrderSummaryRepositoryPort repository;
	private final EventJsonCodec codec;

	@Override
	public String projectionName() {
		return NAME;
	}

	@Override
	public void handle(RecordedEvent event) {
		if (!OrderEventTypes.STREAM_TYPE.equals(event.getStreamType())) {
			return;
		}
		Optional<OrderSummaryView> current = repository.findById(event.getStreamId());
		if (current.isPresent() && current.get().lastPosition() >= event.getGlobalPosition()) {
			log.debug(">>> [Projection] 略過重複事件 {} (position={})", event.getStreamId(), event.getGlobalPosition());
			return;
		}
		OrderSummaryView view = current.orElse(null);

		switch (event.getEventType()) {
		case OrderEventTypes.ORDER_CREATED -> {
			OrderCreated created = codec.fromMap(event.getPayload(), OrderCreated.class);
			save(event, created.customerId(), "OPEN", 0, 0);
		}
		case OrderEventTypes.ITEM_ADDED -> {
			if (event.getSchemaVersion() != ItemAdded.SCHEMA_VERSION) {
				throw new SchemaUpcastException(event.getEventType(), event.getSchemaVersion(),
						"投影只接受 v" + ItemAdded.SCHEMA_VERSION);
			}
			ItemAdded added = codec.fromMap(event.getPayload(), ItemAdded.class);
			OrderSummaryView base = require(view, event);
			save(event, base.customerId(), base.status(), base.itemCount() + added.quantity(),
					base.totalCents() + added.quantity() * added.unitPriceCents());
		}
		case OrderEventTypes.ITEM_REMOVED -> {
			ItemRemoved removed = codec.fromMap(event.getPayload(), ItemRemoved.class);
			OrderSummaryView base = require(view, event);
			save(event, base.customerId(), base.status(), base.itemCount() - removed.quantity(),
					base.totalCents() - removed.quantity() * removed.unitPriceCents());
		}
		case OrderEventTypes.ORDER_CONFIRMED -> {
			OrderSummaryView base = require(view, event);
			save(event, base.customerId(), "CONFIRMED", base.itemCount(), base.totalCents());
		}
		case OrderEventTypes.ORDER_CANCELLED -> {
			OrderSummaryView base = require(view, event);
			save(event, base.customerId(), "CANCELLED", base.itemCount(), base.totalCents());
		}
		default -> log.debug(">>> [Projection] 忽略未知的訂單事件 {}", event.getEventType());
		}
	}

	@Override
	public void reset() {
		repository.deleteAll();
	}

	private void save(RecordedEvent event, String customerId, String status, int itemCount, long totalCents) {
		repository.save(new OrderSummaryView(event.getStreamId(), customerId, status, itemCount, totalCents,
				event.getGlobalPosition(), event.getOccurredAt()));
	}

	private static OrderSummaryView require(OrderSummaryView view, RecordedEvent event) {
		if (view == null) {
			throw new IllegalStateException("訂單摘要不存在，無法套用 " + event.getEventType() + " (" + event.getStreamId() + ")");
		}
		return view;
	}
}
