package kds.dal;

import kds.domain.model.Order;

import java.util.List;
import java.util.Optional;

/**
 * Order persistence owned by the order-management side
 * @since 03/10/2026
 */
public interface IOrderStore {
    Optional<Order> findById(String orderId);

    /**
     * Persist the order including each item's sent flag
     */
    void save(Order order);

    List<Order> list();
}
