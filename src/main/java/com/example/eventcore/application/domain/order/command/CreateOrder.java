package com.example.eventcore.application.domain.order.command;

public record CreateOrder(String customerId) {
}
