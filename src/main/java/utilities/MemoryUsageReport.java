package utilities;

/**
 * JOL footprint of a built automaton: the printable report plus the totals it was
 * rendered from.
 */
public record MemoryUsageReport(String report, long totalBytes, int nodeCount) {

    public double totalMiB() {
        return totalBytes / (1024.0 * 1024.0);
    }

    public double bytesPerNode() {
        return nodeCount == 0 ? 0.0 : totalBytes / (double) nodeCount;
    }
}
