package com.example.eventcore.application.domain.order.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventcore.application.domain.aggregate.AggregateDefinition;
import com.example.eventcore.application.domain.aggregate.PendingEvent;
import com.example.eventcore.application.domain.order.aggregate.vo.OrderStatus;
import com.example.eventcore.application.domain.order.command.AddItem;
import com.example.eventcore.application.domain.order.command.CancelOrder;
import com.example.eventcore.application.domain.order.command.ConfirmOrder;
import com.example.eventcore.application.domain.order.command.CreateOrder;
import com.example.eventcore.application.domain.order.command.RemoveItem;
import com.example.eventcore.application.domain.order.event.ItemAdded;
import com.example.eventcore.application.domain.order.event.OrderConfirmed;
import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.shared.exception.DomainValidationException;

/**
 * <h1>訂單聚合規則</h1>
 *
 * <pre>
 * <b>Given</b> 一連串已發生的事件
 * <b>When</b>  執行指令
 * <b>Then</b>  產生預期事件，或以 DomainValidationException 拒絕
 * </pre>
 */
class OrderAggregateTest {

	private final AggregateDefinition<OrderState> order = OrderAggregate.definition();

	@Test
	@DisplayName("建立、加入品項、確認：總額依明細計算，同 SKU 合併數量")
	void happyPath() {
		OrderState state = given(new CreateOrder("c-1"), new AddItem("A", 2, 500), new AddItem("A", 1, 500),
				new AddItem("B", 1, 250));

		assertThat(state.status()).isEqualTo(OrderStatus.OPEN);
		assertThat(state.lines()).hasSize(2);
		assertThat(state.itemCount()).isEqualTo(4);
		assertThat(state.totalCents()).isEqualTo(1750);

		List<PendingEvent> confirmed = order.execute(state, new ConfirmOrder());
		assertThat(confirmed).singleElement().satisfies(event -> {
			assertThat(event.eventType()).isEqualTo(OrderEventTypes.ORDER_CONFIRMED);
			assertThat(event.payload()).isEqualTo(new OrderConfirmed(1750));
		});
		assertThat(order.fold(state, confirmed).status()).isEqualTo(OrderStatus.CONFIRMED);
	}

	@Test
	@DisplayName("ItemAdded 以目前的 schema 版本產生")
	void itemAddedUsesCurrentSchema() {
		OrderState state = given(new CreateOrder("c-1"));

		PendingEvent event = order.execute(state, new AddItem("A", 1, 100)).get(0);

		assertThat(event.schemaVersion()).isEqualTo(ItemAdded.SCHEMA_VERSION);
	}

	@Test
	@DisplayName("重複建立、單價不一致、移除不存在的品項、確認空訂單皆被拒絕")
	void rejectsInvalidCommands() {
		OrderState created = given(new CreateOrder("c-1"));
		OrderState withItem = given(new CreateOrder("c-1"), new AddItem("A", 1, 500));

		assertThatThrownBy(() -> order.execute(created, new CreateOrder("c-1")))
				.isInstanceOf(DomainValidationException.class);
		assertThatThrownBy(() -> order.execute(withItem, new AddItem("A", 1, 600)))
				.isInstanceOf(DomainValidationException.class);
		assertThatThrownBy(() -> order.execute(created, new AddItem("A", 0, 600)))
				.isInstanceOf(DomainValidationException.class);
		assertThatThrownBy(() -> order.execute(created, new RemoveItem("Z")))
				.isInstanceOf(DomainValidationException.class);
		assertThatThrownBy(() -> order.execute(created, new ConfirmOrder()))
				.isInstanceOf(DomainValidationException.class);
		assertThatThrownBy(() -> order.execute(OrderState.initial(), new CancelOrder("x")))
				.isInstanceOf(DomainValidationException.class);
	}

	@Test
	@DisplayName("確認時帶入的總額與訂單目前總額不符即拒絕")
	void confirmRejectsChangedTotal() {
		// Given: 扣款時總額 500，之後又加入商品
		OrderState changed = given(new CreateOrder("c-1"), new AddItem("A", 1, 500), new AddItem("TV", 1, 30000));

		// Then
		assertThatThrownBy(() -> order.execute(changed, new ConfirmOrder(500L)))
				.isInstanceOf(DomainValidationException.class).hasMessageContaining("30500");
		assertThat(order.execute(changed, new ConfirmOrder(30500L))).hasSize(1);

		OrderState confirmed = given(new CreateOrder("c-1"), new AddItem("A", 1, 500), new ConfirmOrder(500L));
		assertThat(confirmed.status()).isEqualTo(OrderStatus.CONFIRMED);
		assertThat(order.execute(confirmed, new ConfirmOrder(500L))).isEmpty();
		assertThatThrownBy(() -> order.execute(confirmed, new ConfirmOrder(400L)))
				.isInstanceOf(DomainValidationException.class);
	}

	@Test
	@DisplayName("確認與取消重送時不產生事件；已確認的訂單仍可取消 (結帳補償)")
	void confirmAndCancelAreIdempotent() {
		OrderState confirmed = given(new CreateOrder("c-1"), new AddItem("A", 1, 500), new ConfirmOrder());

		assertThat(order.execute(confirmed, new ConfirmOrder())).isEmpty();
		assertThatThrownBy(() -> order.execute(confirmed, new AddItem("B", 1, 1)))
				.isInstanceOf(DomainValidationException.class);

		OrderState cancelled = order.fold(confirmed, order.execute(confirmed, new CancelOrder("refund")));
		assertThat(cancelled.status()).isEqualTo(OrderStatus.CANCELLED);
		assertThat(cancelled.cancelReason()).isEqualTo("refund");
		assertThat(order.execute(cancelled, new CancelOrder("again"))).isEmpty();
	}

	@Test
	@DisplayName("移除品項後總額同步減少")
	void removeItem() {
		OrderState state = given(new CreateOrder("c-1"), new AddItem("A", 2, 500), new AddItem("B", 1, 300),
				new RemoveItem("A"));

		assertThat(state.lines()).extracting(OrderLine::sku).containsExactly("B");
		assertThat(state.totalCents()).isEqualTo(300);
	}

	@Test
	@DisplayName("未註冊的指令型別")
	void unknownCommand() {
		assertThatThrownBy(() -> order.execute(OrderState.initial(), "not-a-command"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private OrderState given(Object... commands) {
		OrderState state = OrderState.initial();
		for (Object command : commands) {
			state = order.fold(state, order.execute(state, command));
		}
		return state;
	}
}
