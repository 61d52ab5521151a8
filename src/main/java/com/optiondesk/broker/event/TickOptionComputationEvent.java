package com.optiondesk.broker.event;

import com.optiondesk.domain.enums.TickType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Greeks computed by the gateway for one option. Values the gateway has not computed arrive as
 * NaN, {@link Double#MAX_VALUE} or a negative IV, so consumers must check every field.
 */
@Getter
@ToString
public class TickOptionComputationEvent extends GatewayEvent {

    private final TickType field;
    private final double impliedVol;
    private final double delta;
    private final double optionPrice;
    private final double gamma;
    private final double vega;
    private final double theta;
    private final double underlyingPrice;

    @Builder
    public TickOptionComputationEvent(
            int requestId,
            TickType field,
            double impliedVol,
            double delta,
            double optionPrice,
            double gamma,
            double vega,
            double theta,
            double underlyingPrice) {
        super(requestId);
        this.field = field;
        this.impliedVol = impliedVol;
        this.delta = delta;
        this.optionPrice = optionPrice;
        this.gamma = gamma;
        this.vega = vega;
        this.theta = theta;
        this.underlyingPrice = underlyingPrice;
    }
}
