package com.trendline.execution.adapter;

import com.trendline.core.model.SignalDirection;

/**
 * Execution confirmation for one order.
 *
 * @param fee       fee charged for the fill, in {@code feeAsset}
 * @param timestamp fill time, epoch millis
 */
public record Fill(
    String orderId,
    SignalDirection direction,
    double price,
    double quantity,
    double fee,
    String feeAsset,
    long timestamp
) {}
