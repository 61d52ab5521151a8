package com.optiondesk.broker;

import com.optiondesk.domain.enums.MarketDataType;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.GatewayOrder;
import com.optiondesk.exception.NotConnectedException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Transport used when no gateway session is configured. Never connected, never emits events. */
public class OfflineGatewayTransport implements GatewayTransport {

    private final List<GatewayEventListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public boolean isConnected() {
        return false;
    }

    @Override
    public void requestMarketDataType(MarketDataType type) {
        throw new NotConnectedException("requestMarketDataType");
    }

    @Override
    public void requestMarketData(int requestId, ContractSpec contract, boolean snapshot) {
        throw new NotConnectedException("requestMarketData");
    }

    @Override
    public void cancelMarketData(int requestId) {
        // nothing subscribed
    }

    @Override
    public void requestContractDetails(int requestId, ContractSpec contract) {
        throw new NotConnectedException("requestContractDetails");
    }

    @Override
    public void requestOptionParameters(
            int requestId, String underlyingSymbol, String underlyingSecType, long underlyingConId) {
        throw new NotConnectedException("requestOptionParameters");
    }

    @Override
    public void placeOrder(int orderId, ContractSpec contract, GatewayOrder order) {
        throw new NotConnectedException("placeOrder");
    }

    @Override
    public void addListener(GatewayEventListener listener) {
        listeners.add(listener);
    }
}
