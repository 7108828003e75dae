package com.example.eventcore.application.service;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.example.eventcore.application.port.OrderSummaryRepositoryPort;
import com.example.eventcore.application.shared.projection.OrderSummaryView;

import lombok.RequiredArgsConstructor;

/**
 * 訂單查詢服務，直接讀取投影結果 (最終一致)
 */
@Service
@RequiredArgsConstructor
public class OrderQueryService {

	private final OrderSummaryRepositoryPort orderSummaryRepository;

	public Optional<OrderSummaryView> getOrderSummary(String orderId) {
		return orderSummaryRepository.findById(orderId);
	}

	public List<OrderSummaryView> getOrdersByCustomer(String customerId) {
		return orderSummaryRepository.findByCustomer(customerId);
	}
}
