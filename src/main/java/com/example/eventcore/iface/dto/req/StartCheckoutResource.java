package com.example.eventcore.iface.dto.req;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 啟動訂單結帳 Saga
 */
@Data
public class StartCheckoutResource {

	@NotBlank(message = "必須指定訂單")
	private String orderId;

	@NotBlank(message = "必須指定顧客帳戶")
	private String customerAccountId;

	@NotBlank(message = "必須指定商家帳戶")
	private String merchantAccountId;

	/**
	 * true 時立即回傳 sagaId，由背景執行緒推進
	 */
	private boolean async;
}
