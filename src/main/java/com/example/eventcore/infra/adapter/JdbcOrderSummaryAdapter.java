package com.example.eventcore.infra.adapter;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.eventcore.application.port.OrderSummaryRepositoryPort;
import com.example.eventcore.application.shared.projection.OrderSummaryView;

import lombok.RequiredArgsConstructor;

@Repository
@RequiredArgsConstructor
public class JdbcOrderSummaryAdapter implements OrderSummaryRepositoryPort {

	private static final String SELECT_COLUMNS = """
			SELECT order_id, customer_id, status, item_count, total_cents, last_position, updated_at
			FROM order_summaries
			""";

	private final JdbcTemplate jdbcTemplate;

	@Override
	public Optional<OrderSummaryView> findById(String orderId) {
		return jdbcTemplate.query(SELECT_COLUMNS + " WHERE order_id = ?", this::mapRow, orderId).stream().findFirst();
	}

	@Override
	public List<OrderSummaryView> findByCustomer(String customerId) {
		return jdbcTemplate.query(SELECT_COLUMNS + " WHERE customer_id = ? ORDER BY order_id", this::mapRow,
				customerId);
	}

	@Override
	public void save(OrderSummaryView view) {
		Timestamp updatedAt = Timestamp.from(view.updatedAt());
		int updated = jdbcTemplate.update("""
				UPDATE order_summaries
				SET customer_id = ?, status = ?, item_count = ?, total_cents = ?, last_position = ?, updated_at = ?
				WHERE order_id = ?
				""", view.customerId(), view.status(), view.itemCount(), view.totalCents(), view.lastPosition(),
				updatedAt, view.orderId());
		if (updated == 0) {
			jdbcTemplate.update("""
					INSERT INTO order_summaries
					    (order_id, customer_id, status, item_count, total_cents, last_position, updated_at)
					VALUES (?, ?, ?, ?, ?, ?, ?)
					""", view.orderId(), view.customerId(), view.status(), view.itemCount(), view.totalCents(),
					view.lastPosition(), updatedAt);
		}
	}

	@Override
	public void deleteAll() {
		jdbcTemplate.update("DELETE FROM order_summaries");
	}

	private OrderSummaryView mapRow(ResultSet rs, int rowNum) throws SQLException {
		return new OrderSummaryView(rs.getString("order_id"), rs.getString("customer_id"), rs.getString("status"),
				rs.getInt("item_count"), rs.getLong("total_cents"), rs.getLong("last_position"),
				rs.getTimestamp("updated_at").toInstant());
	}
}
