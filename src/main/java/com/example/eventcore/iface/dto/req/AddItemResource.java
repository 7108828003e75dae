package com.example.eventcore.iface.dto.req;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 加入訂單品項，金額以「分」為單位
 */
@Data
public class AddItemResource {

	@NotBlank(message = "SKU 不可為空")
	private String sku;

	@NotNull(message = "數量不可為空")
	@Min(value = 1, message = "數量必須大於 0")
	private Integer quantity;

	@NotNull(message = "單價不可為空")
	@Min(value = 0, message = "單價不可為負數")
	private Long unitPriceCents;
}
