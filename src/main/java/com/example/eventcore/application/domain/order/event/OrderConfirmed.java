package com.example.eventcore.application.domain.order.event;

public record OrderConfirmed(long totalCents) {
}
