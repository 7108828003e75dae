package com.example.eventcore.application.port;

import java.util.List;
import java.util.Optional;

import com.example.eventcore.application.shared.projection.OrderSummaryView;

/**
 * 訂單摘要讀取模型存取埠
 */
public interface OrderSummaryRepositoryPort {

	Optional<OrderSummaryView> findById(String orderId);

	List<OrderSummaryView> findByCustomer(String customerId);

	/**
	 * 新增或覆寫訂單摘要 (連同 lastPosition)
	 */
	void save(OrderSummaryView view);

	/**
	 * 清空讀取模型，僅供投影重建使用
	 */
	void deleteAll();
}
