package com.example.eventcore.iface.dto.res;

import com.example.eventcore.application.shared.projection.AccountBalanceView;

public record AccountQueriedResource(String code, String message, AccountBalanceView data) {

}
