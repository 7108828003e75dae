package com.example.eventcore.iface.dto.res;

import com.example.eventcore.application.shared.projection.OrderSummaryView;

public record OrderQueriedResource(String code, String message, OrderSummaryView data) {

}
