package com.example.eventcore.iface.dto.req;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 存提款請求資源
 *
 * <p>
 * 帶入相同 transactionId 重送時不會重複入帳；未填則由伺服器產生。
 * </p>
 */
@Data
public class TransactionResource {

	private String transactionId;

	@NotNull(message = "金額不可為空")
	@Min(value = 1, message = "金額必須大於 0")
	private Long amountCents;
}
