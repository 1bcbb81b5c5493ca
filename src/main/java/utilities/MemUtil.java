package utilities;

import automaton.AhoCorasick;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

public class MemUtil {

    // Detailed JOL report for a built automaton, optionally including the class footprint table.
    public String jolMemoryReport(boolean includeVmDetails, boolean includeFootprintTable, AhoCorasick<?> automaton) {
        StringBuilder sb = new StringBuilder(4_096);

        if (includeVmDetails) {
            // VM details (useful to interpret alignment, header sizes, and compressed oops status)
            sb.append("=== JOL / VM details ===\n");
            sb.append(VM.current().details()).append('\n');
        }

        GraphLayout total = GraphLayout.parseInstance(automaton);
        sb.append("=== ").append(automaton).append(" ===\n");
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / (1024.0 * 1024.0)))
                .append(" MiB\n");
        sb.append("Bytes per node    : ")
                .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) automaton.nodeCount()))
                .append(" B\n");

        if (includeFootprintTable) {
            // Class-by-class histogram (shows how much goes to edge maps versus BitSets)
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }

    // Like jolMemoryReport but also returns the totals.
    public MemoryUsageReport jolMemoryReportWithTotal(boolean includeFootprintTable, AhoCorasick<?> automaton) {
        String txt = jolMemoryReport(false, includeFootprintTable, automaton);
        long totalBytes = GraphLayout.parseInstance(automaton).totalSize();
        MatchLogger.debug("Automaton footprint: " + totalBytes + " B");
        return new MemoryUsageReport(txt, totalBytes, automaton.nodeCount());
    }
}
