package com.modelretraining.service;

import com.modelretraining.model.ResourceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * Host headroom from the OS MXBean. Memory headroom prefers the kernel's
 * MemAvailable estimate, which counts reclaimable page cache, over plain free
 * memory.
 */
@Slf4j
@Component
public class SystemResourceProbe implements ResourceProbe {

    private static final long BYTES_PER_MB = 1024L * 1024L;
    private static final String MEM_AVAILABLE = "MemAvailable:";

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final Path meminfo;

    public SystemResourceProbe() {
        this(Path.of("/proc/meminfo"));
    }

    SystemResourceProbe(Path meminfo) {
        this.meminfo = meminfo;
    }

    @Override
    public ResourceSnapshot snapshot() {
        int processors = Runtime.getRuntime().availableProcessors();
        double freeCpu = processors;
        long freeMemoryMb = Runtime.getRuntime().maxMemory() / BYTES_PER_MB;

        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            double load = sunBean.getCpuLoad();
            // negative load means the JVM cannot sample it yet
            if (load >= 0) {
                freeCpu = processors * (1.0 - load);
            }
            freeMemoryMb = sunBean.getFreeMemorySize() / BYTES_PER_MB;
        } else {
            double loadAverage = osBean.getSystemLoadAverage();
            if (loadAverage >= 0) {
                freeCpu = Math.max(0, processors - loadAverage);
            }
        }
        OptionalLong availableMb = availableMemoryMb();
        if (availableMb.isPresent()) {
            freeMemoryMb = availableMb.getAsLong();
        }
        log.debug("Resource snapshot | freeCpu={} | freeMemoryMb={}", freeCpu, freeMemoryMb);
        return new ResourceSnapshot(freeCpu, freeMemoryMb);
    }

    OptionalLong availableMemoryMb() {
        if (!Files.isReadable(meminfo)) {
            return OptionalLong.empty();
        }
        try {
            OptionalLong kb = parseMemAvailableKb(Files.readAllLines(meminfo, StandardCharsets.US_ASCII));
            return kb.isPresent() ? OptionalLong.of(kb.getAsLong() / 1024L) : kb;
        } catch (IOException ex) {
            log.debug("Meminfo unreadable, using free memory | path={} | error={}", meminfo, ex.getMessage());
            return OptionalLong.empty();
        }
    }

    static OptionalLong parseMemAvailableKb(List<String> lines) {
        for (String line : lines) {
            if (!line.startsWith(MEM_AVAILABLE)) {
                continue;
            }
            String[] parts = line.substring(MEM_AVAILABLE.length()).trim().split("\\s+");
            try {
                return OptionalLong.of(Long.parseLong(parts[0]));
            } catch (NumberFormatException ex) {
                log.debug("Malformed MemAvailable line | line={}", line);
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }
}
