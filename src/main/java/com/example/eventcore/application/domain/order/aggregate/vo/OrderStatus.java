package com.example.eventcore.application.domain.order.aggregate.vo;

public enum OrderStatus {
	/** 尚未建立 */
	NONE,
	OPEN,
	CONFIRMED,
	CANCELLED
}
