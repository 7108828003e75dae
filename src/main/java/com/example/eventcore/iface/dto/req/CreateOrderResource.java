package com.example.eventcore.iface.dto.req;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CreateOrderResource {

	@NotBlank(message = "必須指定顧客")
	private String customerId;
}
