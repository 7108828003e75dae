package com.example.eventcore.iface.rest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.eventcore.application.domain.saga.SagaInstance;
import com.example.eventcore.application.domain.saga.SagaLogEntry;
import com.example.eventcore.application.saga.SagaOrchestrator;
import com.example.eventcore.application.saga.checkout.OrderCheckoutSaga;
import com.example.eventcore.iface.dto.req.StartCheckoutResource;
import com.example.eventcore.iface.dto.res.SagaQueriedResource;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Saga 啟動、查詢與人工介入 API
 */
@Slf4j
@RestController
@RequestMapping("/sagas")
@RequiredArgsConstructor
public class SagaController {

	private final SagaOrchestrator orchestrator;

	/**
	 * 啟動訂單結帳；async 時回傳 202 與目前狀態，否則執行到結束才回應
	 */
	@PostMapping("/" + OrderCheckoutSaga.NAME)
	public ResponseEntity<SagaQueriedResource> startCheckout(@Valid @RequestBody StartCheckoutResource request) {
		Map<String, Object> input = new LinkedHashMap<>();
		input.put(OrderCheckoutSaga.ORDER_ID, request.getOrderId());
		input.put(OrderCheckoutSaga.CUSTOMER_ACCOUNT_ID, request.getCustomerAccountId());
		input.put(OrderCheckoutSaga.MERCHANT_ACCOUNT_ID, request.getMerchantAccountId());

		if (request.isAsync()) {
			String sagaId = orchestrator.startAsync(OrderCheckoutSaga.NAME, input);
			log.info(">>> [Saga] 結帳 Saga {} 已受理 (order={})", sagaId, request.getOrderId());
			return ResponseEntity.status(HttpStatus.ACCEPTED)
					.body(new SagaQueriedResource("202", "Saga 已受理", orchestrator.find(sagaId)));
		}
		SagaInstance instance = orchestrator.start(OrderCheckoutSaga.NAME, input);
		return ResponseEntity.ok(new SagaQueriedResource("200", "Saga 已結束: " + instance.getStatus(), instance));
	}

	@GetMapping("/{id}")
	public ResponseEntity<SagaQueriedResource> getSaga(@PathVariable String id) {
		return ResponseEntity.ok(new SagaQueriedResource("200", "查詢成功", orchestrator.find(id)));
	}

	@GetMapping("/{id}/log")
	public ResponseEntity<List<SagaLogEntry>> getLog(@PathVariable String id) {
		return ResponseEntity.ok(orchestrator.history(id));
	}

	@PostMapping("/{id}/resume")
	public ResponseEntity<SagaQueriedResource> resume(@PathVariable String id) {
		SagaInstance instance = orchestrator.resume(id);
		return ResponseEntity.ok(new SagaQueriedResource("200", "目前狀態: " + instance.getStatus(), instance));
	}

	@PostMapping("/{id}/cancel")
	public ResponseEntity<SagaQueriedResource> cancel(@PathVariable String id) {
		SagaInstance instance = orchestrator.cancel(id);
		return ResponseEntity.ok(new SagaQueriedResource("200", "已送出取消請求，目前狀態: " + instance.getStatus(), instance));
	}
}
