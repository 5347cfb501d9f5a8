package com.trendline.execution.adapter;

import com.trendline.core.exception.TradeExecutionException;
import com.trendline.core.model.SignalDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PaperExecutionAdapterTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private PaperExecutionAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new PaperExecutionAdapter("BTC", "USDT", 10_000, 0.001, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Buy fills at the requested price and pays notional plus fee")
    void buy() throws TradeExecutionException {
        Fill fill = adapter.placeOrder(SignalDirection.BUY, 0.2, 40_000);

        assertEquals(40_000, fill.price());
        assertEquals(0.2, fill.quantity());
        assertEquals(8, fill.fee(), 1e-9);
        assertEquals("USDT", fill.feeAsset());
        assertEquals(NOW.toEpochMilli(), fill.timestamp());
        assertEquals("paper-1", fill.orderId());
        assertEquals(10_000 - 8_000 - 8, adapter.getBalance("USDT"), 1e-9);
        assertEquals(0.2, adapter.getBalance("BTC"), 1e-12);
    }

    @Test
    @DisplayName("Sell credits notional minus fee")
    void sell() throws TradeExecutionException {
        adapter.placeOrder(SignalDirection.BUY, 0.1, 40_000);
        double quoteAfterBuy = adapter.getBalance("USDT");

        Fill fill = adapter.placeOrder(SignalDirection.SELL, 0.1, 42_000);

        assertEquals("paper-2", fill.orderId());
        assertEquals(quoteAfterBuy + 4_200 - 4.2, adapter.getBalance("USDT"), 1e-9);
        assertEquals(0, adapter.getBalance("BTC"), 1e-12);
        assertEquals(2, adapter.getFillHistory().size());
    }

    @Test
    @DisplayName("Orders exceeding balances are rejected without changing them")
    void insufficientBalance() {
        TradeExecutionException buy = assertThrows(TradeExecutionException.class,
            () -> adapter.placeOrder(SignalDirection.BUY, 1, 40_000));
        assertTrue(buy.getMessage().contains("Insufficient USDT"));

        assertThrows(TradeExecutionException.class, () -> adapter.placeOrder(SignalDirection.SELL, 0.1, 40_000));
        assertEquals(10_000, adapter.getBalance("USDT"));
    }

    @Test
    @DisplayName("Non-positive quantity or price is rejected")
    void invalidOrder() {
        assertThrows(TradeExecutionException.class, () -> adapter.placeOrder(SignalDirection.BUY, 0, 40_000));
        assertThrows(TradeExecutionException.class, () -> adapter.placeOrder(SignalDirection.BUY, 0.1, 0));
    }
}
