package com.example.eventcore.application.domain.order.command;

public record RemoveItem(String sku) {
}
