package kds.domain.relay;

import com.google.gson.Gson;
import kds.dal.CatalogConfig;
import kds.dal.PrinterCatalog;
import kds.dal.RelayConfig;
import kds.domain.dispatch.TimedTransmitter;
import kds.domain.dispatch.TransmissionOutcome;
import kds.domain.model.DispatchJob;
import kds.domain.model.PrinterTarget;
import kds.domain.relay.dto.OrderData;
import kds.domain.relay.dto.PrintJobItem;
import kds.domain.relay.dto.PrintJobPayload;
import kds.domain.transport.ETransmissionFailure;
import kds.domain.transport.TicketRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for RelayPollingAgent
 * @since 14/10/2026
 */
@ExtendWith(MockitoExtension.class)
class RelayPollingAgentTest {

    @Mock
    private RelayClient client;

    @Mock
    private TimedTransmitter transmitter;

    @Mock
    private ScheduledExecutorService executor;

    private PrinterCatalog catalog;
    private RelayPollingAgent agent;

    @BeforeEach
    void setUp() throws Exception {
        catalog = new PrinterCatalog(new CatalogConfig("unused.json"), new Gson());
        catalog.replace(List.of(PrinterTarget.network("kitchen", "Kitchen", "10.0.0.5", 9100, 1),
                PrinterTarget.cloud("remote", "Remote", 1)), List.of());
        agent = new RelayPollingAgent(client, catalog, transmitter, new TicketRenderer(), FakeBroker.config("http://broker.test"));
    }

    private static PrintJobPayload payload(String orderId, String content) {
        return new PrintJobPayload("job-" + orderId, orderId, "N-" + orderId, "rest-1", "kitchen",
                List.of(new PrintJobItem("i-1", "Soup", 1, null, "No onions", null)),
                new OrderData("T2", "Ben", "srv-1", "2026-10-12T18:30:00Z", true, 1),
                content, "2026-10-12T18:30:01Z", 1);
    }

    private static PrintJobPayload payload(String jobId, String orderId, String content) {
        PrintJobPayload base = payload(orderId, content);
        return new PrintJobPayload(jobId, base.orderId(), base.orderNumber(), base.restaurantId(),
                base.targetPrinterId(), base.items(), base.orderData(), base.content(), base.timestamp(),
                base.priority());
    }

    @Test
    @DisplayName("Should acknowledge the broker job ids that printed, not their order ids")
    void shouldAcknowledgePrintedJobsOnly() {
        // Given
        when(client.pollJobs("kitchen")).thenReturn(List.of(payload("job-A", "o-1", "1x Soup"),
                payload("job-B", "o-1", "2x Soup")));
        when(transmitter.transmit(any(), any()))
                .thenReturn(TransmissionOutcome.delivered(5))
                .thenReturn(TransmissionOutcome.failed(ETransmissionFailure.TIMEOUT, "Print timeout after 15000ms", 15000));

        // When
        List<String> printed = agent.pollOnce();

        // Then
        assertThat(printed).containsExactly("job-A");
        verify(client).acknowledge("kitchen", List.of("job-A"));
    }

    @Test
    @DisplayName("Printed job without a broker id should not be acknowledged")
    void shouldSkipJobWithoutId() {
        // Given
        when(client.pollJobs("kitchen")).thenReturn(List.of(payload(null, "o-5", "1x Soup")));
        when(transmitter.transmit(any(), any())).thenReturn(TransmissionOutcome.delivered(5));

        // When
        List<String> printed = agent.pollOnce();

        // Then
        assertThat(printed).isEmpty();
        verify(client, never()).acknowledge(anyString(), anyList());
    }

    @Test
    @DisplayName("Empty poll should not acknowledge anything")
    void emptyPollShouldNotAcknowledge() {
        // Given
        when(client.pollJobs("kitchen")).thenReturn(List.of());

        // When & Then
        assertThat(agent.pollOnce()).isEmpty();
        verify(client, never()).acknowledge(anyString(), anyList());
        verifyNoInteractions(transmitter);
    }

    @Test
    @DisplayName("Agent should refuse to print to a missing or CLOUD printer")
    void shouldRefuseMissingOrCloudPrinter() {
        // Given
        RelayConfig base = FakeBroker.config("http://broker.test");
        RelayPollingAgent missing = new RelayPollingAgent(client, catalog, transmitter, new TicketRenderer(),
                withAgentPrinter(base, "nowhere"));
        RelayPollingAgent loop = new RelayPollingAgent(client, catalog, transmitter, new TicketRenderer(),
                withAgentPrinter(base, "remote"));

        // When & Then
        assertThat(missing.pollOnce()).isEmpty();
        assertThat(loop.pollOnce()).isEmpty();
        verifyNoInteractions(client, transmitter);
    }

    @Test
    @DisplayName("Job without ticket text should be rendered locally")
    void shouldRenderMissingContent() {
        // Given
        PrintJobPayload payload = payload("o-3", null);

        // When
        DispatchJob job = agent.toJob(payload, catalog.findById("kitchen").orElseThrow());

        // Then
        assertThat(job.jobId()).isEqualTo("job-o-3");
        assertThat(job.targetId()).isEqualTo("kitchen");
        assertThat(job.content()).contains("KITCHEN TICKET", "Order: N-o-3", "Table: T2", "Special: No onions",
                "Priority: URGENT");
        assertThat(job.order().orderTime()).isEqualTo(1_791_829_800_000L);
    }

    @Test
    @DisplayName("Agent should only be scheduled when enabled")
    void shouldScheduleOnlyWhenEnabled() {
        // Given
        RelayPollingAgent disabled = new RelayPollingAgent(client, catalog, transmitter, new TicketRenderer(),
                RelayConfig.disabled());

        // When
        disabled.start(executor);

        // Then
        assertThat(disabled.isRunning()).isFalse();
        verifyNoInteractions(executor);
    }

    private static RelayConfig withAgentPrinter(RelayConfig c, String printerId) {
        return new RelayConfig(c.enabled(), c.baseUrl(), c.apiToken(), c.restaurantId(), c.deviceName(),
                c.requestTimeoutMs(), c.heartbeatIntervalMs(), c.heartbeatTimeoutMs(), c.statusPollIntervalMs(),
                c.maxHeartbeatRetries(), c.reconnectStepMs(), c.maxReconnectDelayMs(), c.maxReconnectAttempts(),
                c.agentEnabled(), printerId, c.agentPollIntervalMs());
    }
}
