package com.example.eventcore.iface.rest;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.eventcore.application.domain.account.command.Deposit;
import com.example.eventcore.application.domain.account.command.Withdraw;
import com.example.eventcore.application.domain.account.event.AccountEventTypes;
import com.example.eventcore.application.service.AccountQueryService;
import com.example.eventcore.application.service.CommandResult;
import com.example.eventcore.application.service.CommandService;
import com.example.eventcore.iface.dto.req.TransactionResource;
import com.example.eventcore.iface.dto.res.AccountQueriedResource;
import com.example.eventcore.iface.dto.res.CommandResultResource;
import com.example.eventcore.iface.filter.CorrelationIdFilter;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;

/**
 * 帳戶指令與查詢控制器 (Account CQRS Controller)
 */
@RestController
@AllArgsConstructor
@RequestMapping("/accounts")
public class AccountController {

	private final CommandService commandService;
	private final AccountQueryService queryService;

	@PostMapping("/{id}/deposit")
	public ResponseEntity<CommandResultResource> deposit(@PathVariable String id,
			@Valid @RequestBody TransactionResource request) {
		return dispatch(id, new Deposit(transactionId(request), request.getAmountCents()));
	}

	@PostMapping("/{id}/withdraw")
	public ResponseEntity<CommandResultResource> withdraw(@PathVariable String id,
			@Valid @RequestBody TransactionResource request) {
		return dispatch(id, new Withdraw(transactionId(request), request.getAmountCents()));
	}

	/**
	 * 查詢帳戶餘額 (Query Side)，直接讀取投影後的讀取模型
	 */
	@GetMapping("/{id}")
	public ResponseEntity<AccountQueriedResource> getBalance(@PathVariable String id) {
		return queryService.getAccountBalance(id)
				.map(view -> ResponseEntity.ok(new AccountQueriedResource("200", "查詢成功", view)))
				.orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
						.body(new AccountQueriedResource("404", "找不到帳戶 (或尚未投影): " + id, null)));
	}

	private ResponseEntity<CommandResultResource> dispatch(String accountId, Object command) {
		CommandResult result = commandService.submit(AccountEventTypes.STREAM_TYPE, accountId, command,
				CorrelationIdFilter.currentMetadata());
		// 重送同一筆交易不會產生事件
		String message = result.isNoop() ? "交易已處理過" : "交易完成";
		return ResponseEntity.ok(new CommandResultResource("200", message, result));
	}

	private static String transactionId(TransactionResource request) {
		return request.getTransactionId() != null ? request.getTransactionId() : UUID.randomUUID().toString();
	}
}
