package com.optiondesk.broker;

import com.optiondesk.domain.enums.MarketDataType;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.GatewayOrder;

/**
 * The brokerage gateway connection as seen by this service: numbered requests go out,
 * {@link com.optiondesk.broker.event.GatewayEvent}s carrying the same number come back on the
 * listeners, in any order and without a guaranteed end marker.
 *
 * <p>Connecting, reconnecting and authentication belong to the implementation. Send methods
 * return as soon as the request is written and throw
 * {@link com.optiondesk.exception.NotConnectedException} or
 * {@link com.optiondesk.exception.GatewayException} when it cannot be.
 *
 * <p>Implementations must be safe to call from multiple threads.
 */
public interface GatewayTransport {

    boolean isConnected();

    /** Switches the session's market data flavour for subsequent market data requests. */
    void requestMarketDataType(MarketDataType type);

    /**
     * @param snapshot true for a one-shot snapshot, which the gateway terminates with a
     *                 snapshot-end event (usually)
     */
    void requestMarketData(int requestId, ContractSpec contract, boolean snapshot);

    void cancelMarketData(int requestId);

    void requestContractDetails(int requestId, ContractSpec contract);

    void requestOptionParameters(int requestId, String underlyingSymbol, String underlyingSecType, long underlyingConId);

    void placeOrder(int orderId, ContractSpec contract, GatewayOrder order);

    void addListener(GatewayEventListener listener);
}
