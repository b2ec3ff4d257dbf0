package com.tradecycle.backend.service.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradecycle.backend.config.VenueProperties;
import com.tradecycle.backend.exception.VenueException;
import com.tradecycle.backend.model.Candle;
import com.tradecycle.backend.trading.model.OrderRecord;
import com.tradecycle.backend.trading.model.OrderSide;
import com.tradecycle.backend.trading.model.OrderStatus;
import com.tradecycle.backend.trading.model.OrderType;
import com.tradecycle.backend.trading.model.PositionRecord;
import com.tradecycle.backend.trading.model.PositionSide;
import com.tradecycle.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * USD-margined perpetual futures gateway over the Binance REST API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BinanceFuturesGateway implements VenueGateway {

    private static final int OPEN_INTEREST_WINDOW = 24;
    static final int ORDER_DOES_NOT_EXIST = -2013;
    static final int DUPLICATE_CLIENT_ORDER_ID = -4116;

    private final VenueHttpClient httpClient;
    private final VenueProperties venueProperties;
    private final Clock clock;

    @Override
    public VenueBalance getBalance() {
        JsonNode account = httpClient.signedGet("/fapi/v2/account", Map.of());
        return new VenueBalance(
                requiredDecimal(account, "totalWalletBalance"),
                requiredDecimal(account, "availableBalance"),
                decimal(account, "totalInitialMargin"),
                decimal(account, "totalUnrealizedProfit"));
    }

    @Override
    public DailyPerformance getDailyPerformance() {
        long startOfDay = LocalDate.now(clock).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("incomeType", "REALIZED_PNL");
        params.put("startTime", String.valueOf(startOfDay));
        params.put("limit", "1000");
        JsonNode income = httpClient.signedGet("/fapi/v1/income", params);
        requireArray(income, "/fapi/v1/income");

        BigDecimal realized = BigDecimal.ZERO;
        int total = 0;
        int winning = 0;
        for (JsonNode entry : income) {
            BigDecimal amount = decimal(entry, "income");
            realized = realized.add(amount);
            total++;
            if (amount.signum() > 0) {
                winning++;
            }
        }
        return new DailyPerformance(realized, winning, total - winning);
    }

    @Override
    public List<PositionRecord> getPositions() {
        JsonNode positions = httpClient.signedGet("/fapi/v2/positionRisk", Map.of());
        requireArray(positions, "/fapi/v2/positionRisk");

        List<PositionRecord> result = new ArrayList<>();
        for (JsonNode node : positions) {
            BigDecimal amount = decimal(node, "positionAmt");
            if (amount.signum() == 0) {
                continue;
            }
            result.add(PositionRecord.builder()
                    .instrument(venueProperties.instrumentOf(node.path("symbol").asText()))
                    .side(amount.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT)
                    .quantity(amount.abs())
                    .entryPrice(decimal(node, "entryPrice"))
                    .markPrice(decimal(node, "markPrice"))
                    .leverage(node.path("leverage").asInt(1))
                    .unrealizedPnl(decimal(node, "unRealizedProfit"))
                    .tradable(true)
                    .build());
        }
        return result;
    }

    @Override
    public List<OrderRecord> getOpenOrders() {
        JsonNode orders = httpClient.signedGet("/fapi/v1/openOrders", Map.of());
        requireArray(orders, "/fapi/v1/openOrders");
        List<OrderRecord> result = new ArrayList<>();
        for (JsonNode node : orders) {
            result.add(toOrder(node));
        }
        return result;
    }

    @Override
    public IndicatorFeed getIndicators(String instrument) {
        String symbol = venueProperties.symbolOf(instrument);

        JsonNode ticker = httpClient.publicGet("/fapi/v1/ticker/price", Map.of("symbol", symbol));
        BigDecimal price = requiredDecimal(ticker, "price");
        List<Candle> hourly = klines(symbol, "1h");
        List<Candle> daily = klines(symbol, "1d");

        Double openInterestLatest = null;
        Double openInterestAverage = null;
        try {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", symbol);
            params.put("period", "1h");
            params.put("limit", String.valueOf(OPEN_INTEREST_WINDOW));
            JsonNode history = httpClient.publicGet("/futures/data/openInterestHist", params);
            if (history.isArray() && !history.isEmpty()) {
                openInterestLatest = history.get(history.size() - 1).path("sumOpenInterest").asDouble();
                double sum = 0.0;
                for (JsonNode point : history) {
                    sum += point.path("sumOpenInterest").asDouble();
                }
                openInterestAverage = sum / history.size();
            }
        } catch (VenueException e) {
            log.warn("Open interest unavailable instrument={} reason={}", instrument, e.describe());
        }

        Double fundingRatePct = null;
        try {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", symbol);
            params.put("limit", "1");
            JsonNode funding = httpClient.publicGet("/fapi/v1/fundingRate", params);
            if (funding.isArray() && !funding.isEmpty()) {
                fundingRatePct = funding.get(funding.size() - 1).path("fundingRate").asDouble() * 100.0;
            }
        } catch (VenueException e) {
            log.warn("Funding rate unavailable instrument={} reason={}", instrument, e.describe());
        }

        return new IndicatorFeed(instrument, price, hourly, daily, openInterestLatest, openInterestAverage, fundingRatePct);
    }

    @Override
    public void setLeverage(String instrument, int leverage) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", venueProperties.symbolOf(instrument));
        params.put("leverage", String.valueOf(leverage));
        httpClient.signedPost("/fapi/v1/leverage", params);
    }

    @Override
    public OrderRecord placeOrder(OrderRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", venueProperties.symbolOf(request.instrument()));
        params.put("side", request.side().name());
        params.put("type", request.type().name());
        params.put("quantity", MoneyUtils.plain(request.quantity()));
        if (request.stopPrice() != null) {
            params.put("stopPrice", MoneyUtils.plain(request.stopPrice()));
        }
        if (request.type().isProtective()) {
            params.put("workingType", "MARK_PRICE");
        }
        if (request.reduceOnly()) {
            params.put("reduceOnly", "true");
        }
        if (request.clientOrderId() != null) {
            params.put("newClientOrderId", request.clientOrderId());
        }
        params.put("newOrderRespType", "RESULT");
        try {
            return toOrder(httpClient.signedPost("/fapi/v1/order", params));
        } catch (VenueException e) {
            if (request.clientOrderId() == null || !hasCode(e, DUPLICATE_CLIENT_ORDER_ID)) {
                throw e;
            }
            log.info("Order already accepted instrument={} clientOrderId={}", request.instrument(), request.clientOrderId());
            return findOrder(request.instrument(), request.clientOrderId()).orElseThrow(() -> e);
        }
    }

    @Override
    public Optional<OrderRecord> findOrder(String instrument, String clientOrderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", venueProperties.symbolOf(instrument));
        params.put("origClientOrderId", clientOrderId);
        try {
            return Optional.of(toOrder(httpClient.signedGet("/fapi/v1/order", params)));
        } catch (VenueException e) {
            if (hasCode(e, ORDER_DOES_NOT_EXIST)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void cancelOrder(String instrument, String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", venueProperties.symbolOf(instrument));
        params.put("orderId", orderId);
        httpClient.signedDelete("/fapi/v1/order", params);
    }

    private List<Candle> klines(String symbol, String interval) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("interval", interval);
        params.put("limit", String.valueOf(venueProperties.getKlineLimit()));
        JsonNode rows = httpClient.publicGet("/fapi/v1/klines", params);
        requireArray(rows, "/fapi/v1/klines");

        List<Candle> candles = new ArrayList<>();
        for (JsonNode row : rows) {
            if (!row.isArray() || row.size() < 6) {
                throw new VenueException(VenueException.Kind.UNKNOWN, "Malformed kline row for " + symbol);
            }
            candles.add(Candle.builder()
                    .openTime(Instant.ofEpochMilli(row.get(0).asLong()))
                    .open(row.get(1).asDouble())
                    .high(row.get(2).asDouble())
                    .low(row.get(3).asDouble())
                    .close(row.get(4).asDouble())
                    .volume(row.get(5).asDouble())
                    .build());
        }
        return candles;
    }

    private OrderRecord toOrder(JsonNode node) {
        if (!node.hasNonNull("orderId")) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Order response without orderId");
        }
        return OrderRecord.builder()
                .orderId(node.path("orderId").asText())
                .clientOrderId(node.path("clientOrderId").asText(null))
                .instrument(venueProperties.instrumentOf(node.path("symbol").asText()))
                .side(OrderSide.valueOf(node.path("side").asText("BUY").toUpperCase(Locale.ROOT)))
                .type(orderType(node.path("type").asText()))
                .quantity(decimal(node, "origQty"))
                .executedQuantity(decimal(node, "executedQty"))
                .price(decimal(node, "price"))
                .stopPrice(decimal(node, "stopPrice"))
                .averagePrice(decimal(node, "avgPrice"))
                .reduceOnly(node.path("reduceOnly").asBoolean(false))
                .status(OrderStatus.fromVenue(node.path("status").asText(null)))
                .build();
    }

    private static OrderType orderType(String type) {
        return switch (type == null ? "" : type.toUpperCase(Locale.ROOT)) {
            case "STOP", "STOP_MARKET" -> OrderType.STOP_MARKET;
            case "TAKE_PROFIT", "TAKE_PROFIT_MARKET" -> OrderType.TAKE_PROFIT_MARKET;
            case "LIMIT" -> OrderType.LIMIT;
            default -> OrderType.MARKET;
        };
    }

    private static boolean hasCode(VenueException e, int code) {
        return e.getKind() == VenueException.Kind.REJECTED && e.getVenueCode() != null && e.getVenueCode() == code;
    }

    private static void requireArray(JsonNode node, String path) {
        if (node == null || !node.isArray()) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Expected array response from " + path);
        }
    }

    private static BigDecimal requiredDecimal(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Venue response missing field " + field);
        }
        return decimal(node, field);
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        try {
            return MoneyUtils.decimal(node.path(field).asText(null));
        } catch (NumberFormatException e) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Venue field " + field + " is not numeric", e);
        }
    }
}
