package com.example.eventcore.infra.adapter;

import java.sql.Timestamp;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.eventcore.application.port.AccountBalanceRepositoryPort;
import com.example.eventcore.application.shared.projection.AccountBalanceView;

import lombok.RequiredArgsConstructor;

@Repository
@RequiredArgsConstructor
public class JdbcAccountBalanceAdapter implements AccountBalanceRepositoryPort {

	private final JdbcTemplate jdbcTemplate;

	@Override
	public Optional<AccountBalanceView> findById(String accountId) {
		return jdbcTemplate.query("""
				SELECT account_id, balance_cents, last_position, updated_at
				FROM account_balances WHERE account_id = ?
				""", (rs, rowNum) -> new AccountBalanceView(rs.getString("account_id"), rs.getLong("balance_cents"),
				rs.getLong("last_position"), rs.getTimestamp("updated_at").toInstant()), accountId).stream()
				.findFirst();
	}

	@Override
	public void save(AccountBalanceView view) {
		Timestamp updatedAt = Timestamp.from(view.updatedAt());
		int updated = jdbcTemplate.update(
				"UPDATE account_balances SET balance_cents = ?, last_position = ?, updated_at = ? WHERE account_id = ?",
				view.balanceCents(), view.lastPosition(), updatedAt, view.accountId());
		if (updated == 0) {
			jdbcTemplate.update(
					"INSERT INTO account_balances (account_id, balance_cents, last_position, updated_at) VALUES (?, ?, ?, ?)",
					view.accountId(), view.balanceCents(), view.lastPosition(), updatedAt);
		}
	}

	@Override
	public void deleteAll() {
		jdbcTemplate.update("DELETE FROM account_balances");
	}
}
