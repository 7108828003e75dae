package com.example.eventcore.application.domain.order.event;

public record OrderCreated(String customerId) {
}
