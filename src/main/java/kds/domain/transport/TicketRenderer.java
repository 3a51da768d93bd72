package kds.domain.transport;

import kds.common.DispatchConstants;
import kds.domain.model.JobItem;
import kds.domain.model.OrderSnapshot;
import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import javax.inject.Singleton;

/**
 * Plain-text kitchen ticket, 32 columns wide.
 * The layout is shared with kitchen staff and relay agents, do not reorder lines.
 * @since 05/10/2026
 */
@Singleton
public class TicketRenderer {
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss");

    public String render(OrderSnapshot order, String printerName) {
        return render(order, printerName, DateTime.now());
    }

    public String render(OrderSnapshot order, String printerName, DateTime printedAt) {
        String heavy = separator('=');
        String light = separator('-');
        StringBuilder sb = new StringBuilder();

        sb.append(heavy);
        sb.append("        KITCHEN TICKET\n");
        sb.append(heavy);
        sb.append("Order: ").append(order.orderNumber()).append('\n');
        sb.append("Time: ").append(TIME_FORMAT.print(printedAt)).append('\n');
        sb.append("Table: ").append(orDefault(order.tableId(), "Take-Out")).append('\n');
        sb.append("Customer: ").append(orDefault(order.customerName(), "Walk-in")).append('\n');
        sb.append("Server: ").append(orDefault(order.serverId(), "")).append('\n');
        sb.append("Printer: ").append(printerName).append('\n');
        sb.append(heavy);
        sb.append('\n');

        sb.append("ITEMS:\n");
        sb.append(light);
        for (JobItem item : order.items()) {
            sb.append(item.quantity()).append("x ").append(item.name()).append('\n');
            appendIfPresent(sb, "   Variant: ", item.variant());
            appendIfPresent(sb, "   Special: ", item.specialInstructions());
            appendIfPresent(sb, "   Notes: ", item.notes());
            sb.append('\n');
        }

        sb.append(light);
        sb.append("Total Items: ").append(order.items().size()).append('\n');
        sb.append("Priority: ").append(order.urgent() ? "URGENT" : "Normal").append('\n');
        sb.append(heavy);
        sb.append("\n\n\n");
        return sb.toString();
    }

    private static String separator(char character) {
        return String.valueOf(character).repeat(DispatchConstants.TICKET_WIDTH) + "\n";
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (value != null && !value.trim().isEmpty()) {
            sb.append(label).append(value).append('\n');
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value;
    }
}
