package com.example.eventcore.iface.rest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.application.shared.exception.DomainValidationException;
import com.example.eventcore.application.shared.exception.EventCoreException;
import com.example.eventcore.application.shared.exception.SagaNotFoundException;
import com.example.eventcore.iface.dto.res.ErrorResource;

import lombok.extern.slf4j.Slf4j;

/**
 * 將例外轉為 HTTP 回應
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

	@ExceptionHandler(ConcurrencyConflictException.class)
	public ResponseEntity<ErrorResource> handleConflict(ConcurrencyConflictException e) {
		return error(HttpStatus.CONFLICT, e.getMessage());
	}

	@ExceptionHandler(DomainValidationException.class)
	public ResponseEntity<ErrorResource> handleDomainValidation(DomainValidationException e) {
		return error(HttpStatus.UNPROCESSABLE_CONTENT, e.getMessage());
	}

	@ExceptionHandler(SagaNotFoundException.class)
	public ResponseEntity<ErrorResource> handleSagaNotFound(SagaNotFoundException e) {
		return error(HttpStatus.NOT_FOUND, e.getMessage());
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ErrorResource> handleIllegalArgument(IllegalArgumentException e) {
		return error(HttpStatus.BAD_REQUEST, e.getMessage());
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<ErrorResource> handleInvalidRequest(MethodArgumentNotValidException e) {
		String message = e.getBindingResult().getFieldErrors().stream().findFirst()
				.map(error -> error.getField() + ": " + error.getDefaultMessage()).orElse("請求格式錯誤");
		return error(HttpStatus.BAD_REQUEST, message);
	}

	@ExceptionHandler(EventCoreException.class)
	public ResponseEntity<ErrorResource> handleEventCore(EventCoreException e) {
		log.error(">>> [API] 未預期的系統錯誤", e);
		return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
	}

	private static ResponseEntity<ErrorResource> error(HttpStatus status, String message) {
		return ResponseEntity.status(status).body(new ErrorResource(String.valueOf(status.value()), message));
	}
}
