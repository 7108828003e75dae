package com.example.eventcore.application.service;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.example.eventcore.application.port.AccountBalanceRepositoryPort;
import com.example.eventcore.application.shared.projection.AccountBalanceView;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class AccountQueryService {

	private final AccountBalanceRepositoryPort accountBalanceRepository;

	/**
	 * 直接讀取最新的投影結果
	 *
	 * @param accountId 帳戶 ID
	 * @return 帳戶餘額，尚未投影時為 empty
	 */
	public Optional<AccountBalanceView> getAccountBalance(String accountId) {
		return accountBalanceRepository.findById(accountId);
	}
}
