package com.example.eventcore.iface.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.example.eventcore.application.domain.order.command.AddItem;
import com.example.eventcore.application.domain.order.command.CancelOrder;
import com.example.eventcore.application.domain.order.command.CreateOrder;
import com.example.eventcore.application.domain.order.command.RemoveItem;
import com.example.eventcore.application.service.CommandResult;
import com.example.eventcore.application.service.CommandService;
import com.example.eventcore.application.service.OrderQueryService;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.application.shared.exception.DomainValidationException;
import com.example.eventcore.application.shared.projection.OrderSummaryView;

/**
 * <h1>訂單 API 測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 以 standalone MockMvc 驗證請求轉指令與例外轉 HTTP 狀態碼
 * </pre>
 */
class OrderControllerTest {

	private CommandService commandService;
	private OrderQueryService queryService;
	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		commandService = mock(CommandService.class);
		queryService = mock(OrderQueryService.class);
		mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(commandService, queryService))
				.setControllerAdvice(new ApiExceptionHandler()).build();
	}

	@Test
	@DisplayName("建立訂單回應 201 與新的 Stream 版本")
	void createOrder() throws Exception {
		when(commandService.submit(eq("Order"), anyString(), eq(new CreateOrder("c-1")), any(), isNull()))
				.thenReturn(new CommandResult("order-1", 0, 1));

		mockMvc.perform(post("/orders").contentType(MediaType.APPLICATION_JSON).content("{\"customerId\":\"c-1\"}"))
				.andExpect(status().isCreated())
				.andExpect(jsonPath("$.code").value("201"))
				.andExpect(jsonPath("$.data.version").value(0));
	}

	@Test
	@DisplayName("帶 expectedVersion 加入商品，衝突時回應 409")
	void addItemConflict() throws Exception {
		AddItem command = new AddItem("A", 2, 500);
		when(commandService.submit(eq("Order"), eq("order-1"), eq(command), any(), eq(3L)))
				.thenThrow(new ConcurrencyConflictException("order-1", 3, 5));

		mockMvc.perform(post("/orders/order-1/items").param("expectedVersion", "3")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"sku\":\"A\",\"quantity\":2,\"unitPriceCents\":500}"))
				.andExpect(status().isConflict())
				.andExpect(jsonPath("$.code").value("409"));
	}

	@Test
	@DisplayName("領域規則拒絕時回應 422")
	void domainRejection() throws Exception {
		when(commandService.submit(eq("Order"), eq("order-1"), eq(new RemoveItem("Z")), any(), isNull()))
				.thenThrow(new DomainValidationException("訂單中沒有 SKU Z"));

		mockMvc.perform(delete("/orders/order-1/items/Z"))
				.andExpect(status().is(422))
				.andExpect(jsonPath("$.message").value("訂單中沒有 SKU Z"));
	}

	@Test
	@DisplayName("請求內容驗證失敗時回應 400，不送出指令")
	void invalidRequest() throws Exception {
		mockMvc.perform(post("/orders/order-1/items").contentType(MediaType.APPLICATION_JSON)
				.content("{\"sku\":\"A\",\"quantity\":0,\"unitPriceCents\":500}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.code").value("400"));

		verifyNoInteractions(commandService);
	}

	@Test
	@DisplayName("取消訂單可不帶 body")
	void cancelWithoutBody() throws Exception {
		when(commandService.submit(eq("Order"), eq("order-1"), eq(new CancelOrder(null)), any(), isNull()))
				.thenReturn(new CommandResult("order-1", 4, 0));

		mockMvc.perform(post("/orders/order-1/cancel"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.message").value("狀態未變更"));

		verify(commandService).submit(eq("Order"), eq("order-1"), eq(new CancelOrder(null)), any(), isNull());
	}

	@Test
	@DisplayName("查詢讀取模型：存在回應 200，尚未投影回應 404")
	void queryOrders() throws Exception {
		OrderSummaryView view = new OrderSummaryView("order-1", "c-1", "OPEN", 2, 1000, 7, Instant.now());
		when(queryService.getOrderSummary("order-1")).thenReturn(Optional.of(view));
		when(queryService.getOrderSummary("order-2")).thenReturn(Optional.empty());
		when(queryService.getOrdersByCustomer("c-1")).thenReturn(List.of(view));

		mockMvc.perform(get("/orders/order-1"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.data.totalCents").value(1000));
		mockMvc.perform(get("/orders/order-2"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.code").value("404"));
		mockMvc.perform(get("/orders").param("customerId", "c-1"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].orderId").value("order-1"));
	}
}
