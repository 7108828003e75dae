package com.example.eventcore.application.port;

import java.util.Optional;

import com.example.eventcore.application.shared.projection.AccountBalanceView;

/**
 * 帳戶餘額讀取模型存取埠
 */
public interface AccountBalanceRepositoryPort {

	Optional<AccountBalanceView> findById(String accountId);

	void save(AccountBalanceView view);

	void deleteAll();
}
