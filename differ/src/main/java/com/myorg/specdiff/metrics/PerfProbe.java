package com.myorg.specdiff.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import com.sun.management.OperatingSystemMXBean;

/**
 * Step timer that reports to the {@code performance} logger.
 */
public class PerfProbe {
    private static final Logger PERF = LoggerFactory.getLogger("performance");

    private final long t0 = System.nanoTime();
    private long last = t0;
    private final String label;

    public PerfProbe(String label) { this.label = label; }

    public void mark(String stepName, long unitsProcessed) {
        if (!PERF.isInfoEnabled()) return;
        long now = System.nanoTime();
        double ms = (now - last) / 1_000_000.0;
        last = now;

        double rate = ms > 0 ? unitsProcessed / (ms / 1000.0) : 0.0;

        Runtime rt = Runtime.getRuntime();
        double usedMB = (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);

        PERF.info("{} - {} in {} ms ({} items/s, items={}), CPU: {}%, Memory: {} MB",
                label,
                stepName,
                String.format("%.2f", ms),
                String.format("%.2f", rate),
                unitsProcessed,
                String.format("%.1f", cpuPct()),
                String.format("%.2f", usedMB)
        );
    }

    public void done(String stepName) {
        long now = System.nanoTime();
        double totalMs = (now - t0) / 1_000_000.0;
        PERF.info("{} - {} total {} ms",
                label, stepName, String.format("%.2f", totalMs));
    }

    private static double cpuPct() {
        if (ManagementFactory.getOperatingSystemMXBean() instanceof OperatingSystemMXBean os) {
            double load = os.getProcessCpuLoad();
            return load >= 0 ? load * 100.0 : 0.0;
        }
        return 0.0;
    }
}
