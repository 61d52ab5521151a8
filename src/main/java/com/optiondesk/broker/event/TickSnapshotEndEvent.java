package com.optiondesk.broker.event;

/** The gateway finished sending one snapshot. Not sent reliably when many snapshots overlap. */
public class TickSnapshotEndEvent extends GatewayEvent {

    public TickSnapshotEndEvent(int requestId) {
        super(requestId);
    }
}
