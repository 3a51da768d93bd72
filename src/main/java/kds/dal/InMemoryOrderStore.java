package kds.dal;

import kds.domain.model.Order;

import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime order store fed through the REST API
 * @since 04/10/2026
 */
@Singleton
public class InMemoryOrderStore implements IOrderStore {
    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    @Override
    public Optional<Order> findById(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public void save(Order order) {
        orders.put(order.getId(), order);
    }

    @Override
    public List<Order> list() {
        return new ArrayList<>(orders.values());
    }
}
