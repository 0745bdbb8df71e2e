package linkchecker;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

// Best-effort process CPU and memory figures for the run summary. Any value the
// platform does not expose comes back as null.
public class ProcessSampler {

    private static final Path PROC_STATUS = Paths.get("/proc/self/status");

    private final long startWallNanos;
    private final long startCpuNanos;

    private ProcessSampler(long startWallNanos, long startCpuNanos) {
        this.startWallNanos = startWallNanos;
        this.startCpuNanos = startCpuNanos;
    }

    public static ProcessSampler start() {
        return new ProcessSampler(System.nanoTime(), processCpuNanos());
    }

    // Average CPU percent of this process since start(); can exceed 100 on several cores.
    public Double cpuPercentSinceStart() {
        long cpuStart = startCpuNanos;
        long cpuNow = processCpuNanos();
        long wall = System.nanoTime() - startWallNanos;
        if (cpuStart < 0 || cpuNow < 0 || wall <= 0) return null;
        return (cpuNow - cpuStart) * 100.0 / wall;
    }

    // Resident set size in MB (Linux only).
    public Double memoryRssMb() {
        if (!Files.isReadable(PROC_STATUS)) return null;
        try {
            List<String> lines = Files.readAllLines(PROC_STATUS);
            for (String line : lines) {
                if (line.startsWith("VmRSS:")) {
                    // "VmRSS:    123456 kB"
                    String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
                    return Long.parseLong(parts[0]) / 1024.0;
                }
            }
        } catch (IOException | RuntimeException e) {
            System.err.println("Could not read memory usage: " + e.getMessage());
        }
        return null;
    }

    private static long processCpuNanos() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            return ((com.sun.management.OperatingSystemMXBean) os).getProcessCpuTime();
        }
        return -1;
    }
}
