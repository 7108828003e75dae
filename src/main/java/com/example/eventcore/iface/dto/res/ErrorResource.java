package com.example.eventcore.iface.dto.res;

public record ErrorResource(String code, String message) {

}
