package kds.domain.transport;

import kds.common.ETransportType;
import kds.domain.model.DispatchJob;
import kds.domain.model.OrderSnapshot;
import kds.domain.model.PrinterTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for TransportRouter
 * @since 13/10/2026
 */
@ExtendWith(MockitoExtension.class)
class TransportRouterTest {

    @Mock
    private IPrinterTransport networkTransport;

    private final DispatchJob job = DispatchJob.create("kitchen",
            new OrderSnapshot("o-1", "1", null, null, null, false, 0, 1L, List.of()), "ticket");

    @Test
    @DisplayName("Should route by the printer's transport type")
    void shouldRouteByTransportType() throws Exception {
        // Given
        TransportRouter router = new TransportRouter(Map.of(ETransportType.NETWORK, networkTransport));
        PrinterTarget kitchen = PrinterTarget.network("kitchen", "Kitchen", "10.0.0.5", 9100, 1);
        when(networkTransport.send(kitchen, job)).thenReturn(true);

        // When
        boolean accepted = router.send(kitchen, job);

        // Then
        assertThat(accepted).isTrue();
        verify(networkTransport).send(kitchen, job);
    }

    @Test
    @DisplayName("Printer without a registered transport should be unreachable and fail to send")
    void shouldFailWithoutTransport() {
        // Given
        TransportRouter router = new TransportRouter(Map.of(ETransportType.NETWORK, networkTransport));
        PrinterTarget cloud = PrinterTarget.cloud("remote", "Remote", 1);

        // When & Then
        assertThat(router.isReachable(cloud)).isFalse();
        assertThatThrownBy(() -> router.send(cloud, job))
                .isInstanceOf(TransmissionException.class)
                .satisfies(e -> assertThat(((TransmissionException) e).getFailure())
                        .isEqualTo(ETransmissionFailure.NETWORK_ERROR));
    }

    @Test
    @DisplayName("Failing reachability check should count as unreachable")
    void shouldTreatCheckErrorAsUnreachable() {
        // Given
        TransportRouter router = new TransportRouter(Map.of(ETransportType.NETWORK, networkTransport));
        when(networkTransport.isReachable(any())).thenThrow(new IllegalStateException("boom"));

        // When & Then
        assertThat(router.isReachable(PrinterTarget.network("kitchen", "Kitchen", "10.0.0.5", 9100, 1))).isFalse();
    }
}
