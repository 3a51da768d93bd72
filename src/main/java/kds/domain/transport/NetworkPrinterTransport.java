package kds.domain.transport;

import com.github.anastaciocintra.escpos.EscPos;
import kds.dal.DispatchConfig;
import kds.domain.model.DispatchJob;
import kds.domain.model.PrinterTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.Channels;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.SocketChannel;

/**
 * ESC/POS printing over raw TCP (port 9100 style printers).
 *
 * <p>Each job opens its own connection. The socket is an NIO {@link SocketChannel}, so interrupting the sending
 * thread (what a timed-out dispatch does) closes the connection instead of leaving it hanging.</p>
 *
 * @since 05/10/2026
 */
@Singleton
public class NetworkPrinterTransport implements IPrinterTransport {
    private static final Logger logger = LoggerFactory.getLogger(NetworkPrinterTransport.class);
    private static final int FEED_LINES = 3;

    private final DispatchConfig config;

    @Inject
    public NetworkPrinterTransport(DispatchConfig config) {
        this.config = config;
    }

    @Override
    public boolean send(PrinterTarget target, DispatchJob job) throws TransmissionException {
        if (!target.hasValidAddress()) {
            throw new TransmissionException(ETransmissionFailure.NETWORK_ERROR,
                    "Printer " + target.name() + " has no valid network address");
        }

        logger.debug("Connecting to network printer {} at {}", target.name(), target.getAddress());
        try (SocketChannel channel = SocketChannel.open()) {
            channel.socket().connect(new InetSocketAddress(target.host(), target.port()), config.connectTimeoutMs());

            OutputStream outputStream = Channels.newOutputStream(channel);
            EscPos escpos = new EscPos(outputStream);
            escpos.setCharacterCodeTable(EscPos.CharacterCodeTable.CP852_Latin2);
            escpos.initializePrinter();
            escpos.write(job.content());
            escpos.feed(FEED_LINES);
            escpos.cut(EscPos.CutMode.FULL);
            outputStream.flush();

            logger.info("Ticket for order {} printed on {} ({} items)",
                    job.order().orderNumber(), target.name(), job.order().items().size());
            return true;

        } catch (ClosedByInterruptException e) {
            throw new TransmissionException(ETransmissionFailure.TIMEOUT,
                    "Transmission to " + target.name() + " was cancelled", e);
        } catch (SocketTimeoutException e) {
            throw new TransmissionException(ETransmissionFailure.TIMEOUT,
                    "Printer " + target.name() + " did not answer in time", e);
        } catch (UnknownHostException e) {
            throw new TransmissionException(ETransmissionFailure.NETWORK_ERROR,
                    "Unknown printer host " + target.host(), e);
        } catch (IOException e) {
            throw new TransmissionException(ETransmissionFailure.NETWORK_ERROR,
                    "Printer " + target.name() + " unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isReachable(PrinterTarget target) {
        if (!target.hasValidAddress()) {
            return false;
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(target.host(), target.port()), config.connectTimeoutMs());
            return true;
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("Printer {} at {} not reachable: {}", target.name(), target.getAddress(), e.getMessage());
            return false;
        }
    }
}
