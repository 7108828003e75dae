package com.example.eventcore.application.domain.order.command;

public record AddItem(String sku, int quantity, long unitPriceCents) {
}
