package com.example.eventcore.application.domain.order.command;

public record CancelOrder(String reason) {
}
