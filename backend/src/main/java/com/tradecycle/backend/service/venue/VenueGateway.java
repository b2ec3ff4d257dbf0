package com.tradecycle.backend.service.venue;

import com.tradecycle.backend.trading.model.OrderRecord;
import com.tradecycle.backend.trading.model.PositionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Thin seam over the futures exchange. Every method either returns venue data or throws
 * {@link com.tradecycle.backend.exception.VenueException}.
 */
public interface VenueGateway {

    VenueBalance getBalance();

    DailyPerformance getDailyPerformance();

    List<PositionRecord> getPositions();

    List<OrderRecord> getOpenOrders();

    IndicatorFeed getIndicators(String instrument);

    void setLeverage(String instrument, int leverage);

    /**
     * Idempotent per {@link OrderRequest#clientOrderId()}: resubmitting an id the venue already
     * accepted returns that order instead of creating a second one.
     */
    OrderRecord placeOrder(OrderRequest request);

    /**
     * Looks an order up by the client order id it was submitted with. Empty when the venue never accepted it.
     */
    Optional<OrderRecord> findOrder(String instrument, String clientOrderId);

    void cancelOrder(String instrument, String orderId);
}
