package kds.domain.dispatch;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import kds.common.DispatchConstants;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Delivery state per (order item, printer).
 *
 * <p>An item's {@code sentToKitchen} flag only says the kitchen was committed to; this ledger records what actually
 * reached each printer. COMMITTED is written before any transmission, DELIVERED or FAILED after each attempt.</p>
 *
 * <p>An order is forgotten once it has not been touched for {@link DispatchConstants#LEDGER_RETENTION_HOURS}
 * hours.</p>
 *
 * @since 08/10/2026
 */
@Singleton
public class DeliveryLedger {
    // orderId -> itemId -> printerId -> state
    private final Cache<String, Map<String, Map<String, EDeliveryState>>> orders;
    private final Map<String, Map<String, Map<String, EDeliveryState>>> ledger;

    @Inject
    public DeliveryLedger() {
        this(Duration.ofHours(DispatchConstants.LEDGER_RETENTION_HOURS), Ticker.systemTicker());
    }

    DeliveryLedger(Duration retention, Ticker ticker) {
        this.orders = CacheBuilder.newBuilder()
                .expireAfterAccess(retention)
                .ticker(ticker)
                .build();
        this.ledger = orders.asMap();
    }

    /**
     * Orders currently tracked
     */
    public long trackedOrders() {
        orders.cleanUp();
        return orders.size();
    }

    public void commit(String orderId, String itemId, String printerId) {
        itemStates(orderId, itemId).putIfAbsent(printerId, EDeliveryState.COMMITTED);
    }

    public void markDelivered(String orderId, Collection<String> itemIds, String printerId) {
        for (String itemId : itemIds) {
            itemStates(orderId, itemId).put(printerId, EDeliveryState.DELIVERED);
        }
    }

    public void markFailed(String orderId, Collection<String> itemIds, String printerId) {
        for (String itemId : itemIds) {
            itemStates(orderId, itemId).put(printerId, EDeliveryState.FAILED);
        }
    }

    public Optional<EDeliveryState> stateOf(String orderId, String itemId, String printerId) {
        Map<String, Map<String, EDeliveryState>> items = ledger.get(orderId);
        if (items == null || !items.containsKey(itemId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(items.get(itemId).get(printerId));
    }

    /**
     * Items of an order that were committed to the given printer
     */
    public List<String> itemsFor(String orderId, String printerId) {
        Map<String, Map<String, EDeliveryState>> items = ledger.get(orderId);
        if (items == null) {
            return List.of();
        }
        return items.entrySet().stream()
                .filter(e -> e.getValue().containsKey(printerId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * True once every printer the item was committed to has confirmed delivery
     */
    public boolean isFullyDelivered(String orderId, String itemId) {
        Map<String, Map<String, EDeliveryState>> items = ledger.get(orderId);
        if (items == null || !items.containsKey(itemId)) {
            return false;
        }
        Map<String, EDeliveryState> states = items.get(itemId);
        return !states.isEmpty() && states.values().stream().allMatch(s -> s == EDeliveryState.DELIVERED);
    }

    public Map<String, Map<String, EDeliveryState>> snapshot(String orderId) {
        Map<String, Map<String, EDeliveryState>> items = ledger.get(orderId);
        Map<String, Map<String, EDeliveryState>> copy = new LinkedHashMap<>();
        if (items != null) {
            items.forEach((itemId, states) -> copy.put(itemId, new LinkedHashMap<>(states)));
        }
        return copy;
    }

    private Map<String, EDeliveryState> itemStates(String orderId, String itemId) {
        return ledger.computeIfAbsent(orderId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(itemId, k -> new ConcurrentHashMap<>());
    }
}
