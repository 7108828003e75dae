package com.example.eventcore.iface.dto.req;

import lombok.Data;

@Data
public class CancelOrderResource {

	/**
	 * 取消原因，可選填
	 */
	private String reason;
}
