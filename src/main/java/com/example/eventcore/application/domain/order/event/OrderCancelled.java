package com.example.eventcore.application.domain.order.event;

public record OrderCancelled(String reason) {
}
