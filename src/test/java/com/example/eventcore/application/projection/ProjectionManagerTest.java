package com.example.eventcore.application.projection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventcore.application.domain.account.aggregate.AccountAggregate;
import com.example.eventcore.application.domain.account.aggregate.AccountState;
import com.example.eventcore.application.domain.account.command.Deposit;
import com.example.eventcore.application.domain.account.command.Withdraw;
import com.example.eventcore.application.domain.event.EventMetadata;
import com.example.eventcore.application.domain.event.NewEvent;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.domain.order.aggregate.OrderAggregate;
import com.example.eventcore.application.domain.order.aggregate.OrderState;
import com.example.eventcore.application.domain.order.command.AddItem;
import com.example.eventcore.application.domain.order.command.ConfirmOrder;
import com.example.eventcore.application.domain.order.command.CreateOrder;
import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.domain.order.upcast.ItemAddedV1ToV2Upcaster;
import com.example.eventcore.application.domain.order.upcast.ItemAddedV2ToV3Upcaster;
import com.example.eventcore.application.domain.snapshot.SnapshotPolicy;
import com.example.eventcore.application.domain.upcast.UpcasterChain;
import com.example.eventcore.application.service.AggregateEngine;
import com.example.eventcore.application.shared.exception.ProjectionHandlerException;
import com.example.eventcore.application.shared.projection.OrderSummaryView;
import com.example.eventcore.infra.adapter.JdbcAccountBalanceAdapter;
import com.example.eventcore.infra.adapter.JdbcCheckpointAdapter;
import com.example.eventcore.infra.adapter.JdbcEventLogAdapter;
import com.example.eventcore.infra.adapter.JdbcOrderSummaryAdapter;
import com.example.eventcore.infra.adapter.JdbcSnapshotAdapter;
import com.example.eventcore.support.TestDatabase;

/**
 * <h1>投影管理器測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 訂單與帳戶事件寫入同一份全域日誌，兩個投影各自依 Checkpoint 前進
 * <b>Then</b>   讀取模型等於依全域順序套用所有事件的結果，失敗時 Checkpoint 停在失敗事件之前
 * </pre>
 */
class ProjectionManagerTest {

	private TestDatabase database;
	private JdbcEventLogAdapter eventLog;
	private JdbcCheckpointAdapter checkpoints;
	private JdbcOrderSummaryAdapter orderSummaries;
	private JdbcAccountBalanceAdapter accountBalances;
	private OrderSummaryProjector orderProjector;
	private ProjectionManager manager;
	private AggregateEngine<OrderState> orders;
	private AggregateEngine<AccountState> accounts;

	@BeforeEach
	void setUp() {
		database = TestDatabase.create();
		eventLog = new JdbcEventLogAdapter(database.jdbcTemplate(), database.transactionManager(), database.codec());
		checkpoints = new JdbcCheckpointAdapter(database.jdbcTemplate());
		orderSummaries = new JdbcOrderSummaryAdapter(database.jdbcTemplate());
		accountBalances = new JdbcAccountBalanceAdapter(database.jdbcTemplate());
		orderProjector = new OrderSummaryProjector(orderSummaries, database.codec());

		UpcasterChain upcasters = new UpcasterChain(
				List.of(new ItemAddedV1ToV2Upcaster(), new ItemAddedV2ToV3Upcaster()));
		JdbcSnapshotAdapter snapshots = new JdbcSnapshotAdapter(database.jdbcTemplate(), database.codec());
		orders = new AggregateEngine<>(OrderAggregate.definition(), eventLog, snapshots, upcasters, database.codec(),
				SnapshotPolicy.disabled(), Clock.systemUTC());
		accounts = new AggregateEngine<>(AccountAggregate.definition(), eventLog, snapshots, upcasters,
				database.codec(), SnapshotPolicy.disabled(), Clock.systemUTC());
		// batch 3 讓追趕跨越多個分頁
		manager = new ProjectionManager(eventLog, upcasters, checkpoints, 3, Duration.ofMillis(20),
				Duration.ofMillis(50), Clock.systemUTC());
	}

	@AfterEach
	void tearDown() {
		manager.shutdown();
		database.shutdown();
	}

	@Test
	@DisplayName("追趕後讀取模型正確、Checkpoint 指向最後一筆，再次追趕不重複套用")
	void catchUpBuildsReadModels() {
		// Given
		order("order-1", new CreateOrder("c-1"), new AddItem("A", 2, 500), new ConfirmOrder());
		account("acc-1", new Deposit("tx-1", 1000), new Withdraw("tx-2", 250));
		order("order-2", new CreateOrder("c-1"), new AddItem("B", 1, 300));
		eventLog.append("order-3", -1, List.of(
				raw(OrderEventTypes.ORDER_CREATED, 1, Map.of("customerId", "c-2")),
				raw(OrderEventTypes.ITEM_ADDED, 1, Map.of("sku", "OLD", "price", 9.99))));
		AccountBalanceProjector accountProjector = new AccountBalanceProjector(accountBalances, database.codec());

		// When
		int applied = manager.catchUp(OrderSummaryProjector.NAME, orderProjector);
		manager.catchUp(AccountBalanceProjector.NAME, accountProjector);

		// Then
		assertThat(applied).isEqualTo(9);
		assertThat(checkpoints.load(OrderSummaryProjector.NAME)).isEqualTo(lastPosition());
		assertThat(orderSummaries.findById("order-1")).get().satisfies(view -> {
			assertThat(view.status()).isEqualTo("CONFIRMED");
			assertThat(view.totalCents()).isEqualTo(1000);
		});
		assertThat(orderSummaries.findByCustomer("c-1")).extracting(OrderSummaryView::orderId)
				.containsExactly("order-1", "order-2");
		assertThat(orderSummaries.findById("order-3")).get().extracting(OrderSummaryView::totalCents).isEqualTo(999L);
		assertThat(accountBalances.findById("acc-1")).get().satisfies(view -> assertThat(view.balanceCents()).isEqualTo(750));

		assertThat(manager.catchUp(OrderSummaryProjector.NAME, orderProjector)).isZero();
		assertThat(manager.status(OrderSummaryProjector.NAME).isHealthy()).isTrue();
	}

	@Test
	@DisplayName("投影處理器重複收到同一事件時結果不變")
	void projectorIsIdempotent() {
		order("order-1", new CreateOrder("c-1"), new AddItem("A", 2, 500));
		List<RecordedEvent> events = eventLog.readAll(0, 100);

		events.forEach(orderProjector::handle);
		OrderSummaryView once = orderSummaries.findById("order-1").orElseThrow();
		events.forEach(orderProjector::handle);

		assertThat(orderSummaries.findById("order-1")).contains(once);
	}

	@Test
	@DisplayName("處理器失敗時停在失敗事件之前，排除問題後從同一位置續傳")
	void haltsOnHandlerFailure() {
		// Given
		order("order-1", new CreateOrder("c-1"), new AddItem("A", 1, 100), new ConfirmOrder());
		AtomicBoolean broken = new AtomicBoolean(true);
		ProjectionHandler flaky = new ProjectionHandler() {
			@Override
			public String projectionName() {
				return "flaky";
			}

			@Override
			public void handle(RecordedEvent event) {
				if (broken.get() && OrderEventTypes.ORDER_CONFIRMED.equals(event.getEventType())) {
					throw new IllegalStateException("read model unavailable");
				}
				orderProjector.handle(event);
			}

			@Override
			public void reset() {
				orderProjector.reset();
			}
		};

		// When
		assertThatThrownBy(() -> manager.catchUp("flaky", flaky))
				.isInstanceOfSatisfying(ProjectionHandlerException.class,
						e -> assertThat(e.getGlobalPosition()).isEqualTo(3));

		// Then
		assertThat(checkpoints.load("flaky")).isEqualTo(2);
		ProjectionStatus failed = manager.status("flaky");
		assertThat(failed.isHealthy()).isFalse();
		assertThat(failed.failedPosition()).isEqualTo(3L);
		assertThat(failed.consecutiveFailures()).isEqualTo(1);
		assertThat(orderSummaries.findById("order-1")).get().extracting(OrderSummaryView::status).isEqualTo("OPEN");

		// When
		broken.set(false);
		assertThat(manager.catchUp("flaky", flaky)).isEqualTo(1);

		// Then
		assertThat(manager.status("flaky").isHealthy()).isTrue();
		assertThat(checkpoints.load("flaky")).isEqualTo(3);
	}

	@Test
	@DisplayName("重建會清空讀取模型並從頭套用")
	void rebuildReplaysFromStart() {
		order("order-1", new CreateOrder("c-1"), new AddItem("A", 1, 100));
		manager.catchUp(OrderSummaryProjector.NAME, orderProjector);
		database.jdbcTemplate().update("UPDATE order_summaries SET total_cents = 0");

		int replayed = manager.rebuild(OrderSummaryProjector.NAME, orderProjector);

		assertThat(replayed).isEqualTo(2);
		assertThat(orderSummaries.findById("order-1")).get().extracting(OrderSummaryView::totalCents).isEqualTo(100L);
		assertThat(checkpoints.load(OrderSummaryProjector.NAME)).isEqualTo(2);
	}

	@Test
	@DisplayName("背景工作持續跟隨新事件，重建在同一執行緒中執行")
	void backgroundWorkerFollowsLog() {
		// Given
		order("order-1", new CreateOrder("c-1"));
		manager.run(orderProjector);

		// When
		order("order-1", new AddItem("A", 3, 100));

		// Then
		await().atMost(Duration.ofSeconds(5))
				.untilAsserted(() -> assertThat(checkpoints.load(OrderSummaryProjector.NAME)).isEqualTo(lastPosition()));
		assertThat(orderSummaries.findById("order-1")).get().extracting(OrderSummaryView::itemCount).isEqualTo(3);
		assertThat(manager.status(OrderSummaryProjector.NAME).running()).isTrue();
		assertThat(manager.rebuild(OrderSummaryProjector.NAME)).isEqualTo(2);
		assertThatThrownBy(() -> manager.run(orderProjector)).isInstanceOf(IllegalStateException.class);

		// When
		manager.stop(OrderSummaryProjector.NAME);

		// Then
		assertThat(manager.status(OrderSummaryProjector.NAME).running()).isFalse();
		assertThat(manager.statuses()).extracting(ProjectionStatus::projectionName)
				.contains(OrderSummaryProjector.NAME);
	}

	private void order(String orderId, Object... commands) {
		for (Object command : commands) {
			orders.handle(orderId, command, EventMetadata.none(), null);
		}
	}

	private void account(String accountId, Object... commands) {
		for (Object command : commands) {
			accounts.handle(accountId, command, EventMetadata.none(), null);
		}
	}

	private long lastPosition() {
		List<RecordedEvent> all = eventLog.readAll(0, 1000);
		return all.get(all.size() - 1).getGlobalPosition();
	}

	private static NewEvent raw(String eventType, int schemaVersion, Map<String, Object> payload) {
		return NewEvent.builder().streamType(OrderEventTypes.STREAM_TYPE).eventType(eventType)
				.schemaVersion(schemaVersion).payload(payload).occurredAt(Instant.now()).build();
	}
}
