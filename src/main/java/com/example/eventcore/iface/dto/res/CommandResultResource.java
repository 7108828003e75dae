package com.example.eventcore.iface.dto.res;

import com.example.eventcore.application.service.CommandResult;

public record CommandResultResource(String code, String message, CommandResult data) {

}
