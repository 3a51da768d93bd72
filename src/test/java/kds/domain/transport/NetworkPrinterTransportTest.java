package kds.domain.transport;

import kds.dal.DispatchConfig;
import kds.domain.model.DispatchJob;
import kds.domain.model.JobItem;
import kds.domain.model.OrderSnapshot;
import kds.domain.model.PrinterTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for NetworkPrinterTransport against a local socket standing in for a port 9100 printer
 * @since 13/10/2026
 */
class NetworkPrinterTransportTest {

    private final NetworkPrinterTransport transport = new NetworkPrinterTransport(new DispatchConfig(2000, 0, 500, 1, 0));

    private static DispatchJob job() {
        return DispatchJob.create("kitchen",
                new OrderSnapshot("o-1", "42", null, null, null, false, 0, 1L,
                        List.of(new JobItem("i-1", "steak", "Steak", 1, null, null, null))),
                "Order: 42\n1x Steak\n");
    }

    @Test
    @DisplayName("Should stream the ticket to the printer socket")
    void shouldWriteTicketToSocket() throws Exception {
        try (ServerSocket printer = new ServerSocket(0)) {
            // Given
            CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
                try (Socket client = printer.accept(); InputStream in = client.getInputStream()) {
                    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
                    in.transferTo(bytes);
                    return bytes.toString(StandardCharsets.ISO_8859_1);
                } catch (Exception e) {
                    return "error: " + e.getMessage();
                }
            });
            PrinterTarget target = PrinterTarget.network("kitchen", "Kitchen", "127.0.0.1", printer.getLocalPort(), 1);

            // When
            boolean accepted = transport.send(target, job());

            // Then
            assertThat(accepted).isTrue();
            assertThat(received.get(5, TimeUnit.SECONDS)).contains("Order: 42", "1x Steak");
        }
    }

    @Test
    @DisplayName("Closed port should fail with NETWORK_ERROR and be unreachable")
    void closedPortShouldFail() throws Exception {
        // Given
        int port;
        try (ServerSocket free = new ServerSocket(0)) {
            port = free.getLocalPort();
        }
        PrinterTarget target = PrinterTarget.network("kitchen", "Kitchen", "127.0.0.1", port, 1);

        // When & Then
        assertThat(transport.isReachable(target)).isFalse();
        assertThatThrownBy(() -> transport.send(target, job()))
                .isInstanceOf(TransmissionException.class)
                .satisfies(e -> assertThat(((TransmissionException) e).getFailure())
                        .isEqualTo(ETransmissionFailure.NETWORK_ERROR));
    }

    @Test
    @DisplayName("Invalid address should be rejected without connecting")
    void invalidAddressShouldFail() {
        // Given
        PrinterTarget target = PrinterTarget.network("kitchen", "Kitchen", "", 0, 1);

        // When & Then
        assertThat(transport.isReachable(target)).isFalse();
        assertThatThrownBy(() -> transport.send(target, job()))
                .isInstanceOf(TransmissionException.class)
                .hasMessageContaining("no valid network address");
    }
}
