package com.optiondesk.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.optiondesk.broker.ConnectionStatusRelay;
import com.optiondesk.broker.event.ConnectionStateEvent;
import com.optiondesk.domain.enums.ConnectionStatus;
import com.optiondesk.event.ConnectionStatusEvent;
import com.optiondesk.event.EventPublisherHelper;
import com.optiondesk.unit.support.FakeGatewayTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class ConnectionStatusRelayTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private final FakeGatewayTransport transport = new FakeGatewayTransport();

    @AfterEach
    void tearDown() {
        transport.close();
    }

    @Test
    @DisplayName("Transport connection changes are republished as application events")
    void republishesConnectionState() {
        new ConnectionStatusRelay(transport, new EventPublisherHelper(applicationEventPublisher));

        transport.emit(new ConnectionStateEvent(ConnectionStatus.CONNECTED, "gateway 127.0.0.1:4002"));

        ArgumentCaptor<ConnectionStatusEvent> captor = ArgumentCaptor.forClass(ConnectionStatusEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(captor.getValue().getMessage()).isEqualTo("gateway 127.0.0.1:4002");
    }
}
