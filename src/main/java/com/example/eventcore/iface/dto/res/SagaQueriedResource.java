package com.example.eventcore.iface.dto.res;

import com.example.eventcore.application.domain.saga.SagaInstance;

public record SagaQueriedResource(String code, String message, SagaInstance data) {

}
