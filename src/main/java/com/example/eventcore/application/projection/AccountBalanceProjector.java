package com.example.eventcore.application.projection;

import java.util.Optional;

import com.example.eventcore.application.domain.account.event.AccountEventTypes;
import com.example.eventcore.application.domain.account.event.MoneyDeposited;
import com.example.eventcore.application.domain.account.event.MoneyWithdrawn;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.port.AccountBalanceRepositoryPort;
import com.example.eventcore.application.shared.projection.AccountBalanceView;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;

/**
 * 帳戶餘額投影
 */
@RequiredArgsConstructor
public class AccountBalanceProjector implements ProjectionHandler {

	public static final String NAME = "account-balance";

	private final AccountBalanceRepositoryPort repository;
	private final EventJsonCodec codec;

	@Override
	public String projectionName() {
		return NAME;
	}

	@Override
	public void handle(RecordedEvent event) {
		if (!AccountEventTypes.STREAM_TYPE.equals(event.getStreamType())) {
			return;
		}
		long delta;
		if (AccountEventTypes.MONEY_DEPOSITED.equals(event.getEventType())) {
			delta = codec.fromMap(event.getPayload(), MoneyDeposited.class).amountCents();
		} else if (AccountEventTypes.MONEY_WITHDRAWN.equals(event.getEventType())) {
			delta = -codec.fromMap(event.getPayload(), MoneyWithdrawn.class).amountCents();
		} else {
			return;
		}

		Optional<AccountBalanceView> current = repository.findById(event.getStreamId());
		if (current.isPresent() && current.get().lastPosition() >= event.getGlobalPosition()) {
			return;
		}
		long balance = current.map(AccountBalanceView::balanceCents).orElse(0L) + delta;
		repository.save(new AccountBalanceView(event.getStreamId(), balance, event.getGlobalPosition(),
				event.getOccurredAt()));
	}

	@Override
	public void reset() {
		repository.deleteAll();
	}
}
