package io.shotmatrix.planning;

import io.shotmatrix.config.Defaults;
import io.shotmatrix.error.PortRangeException;
import io.shotmatrix.model.PortAllocation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic port windows per job index. No sockets are probed.
 */
public final class PortAllocator {
    private final int basePort;
    private final int portOffset;

    public PortAllocator() {
        this(Defaults.BASE_PORT, Defaults.PORT_OFFSET);
    }

    public PortAllocator(int basePort, int portOffset) {
        if (basePort < Defaults.MIN_PORT || basePort > Defaults.MAX_PORT) {
            throw new PortRangeException("Base port must be between " + Defaults.MIN_PORT + " and "
                    + Defaults.MAX_PORT + ", got " + basePort);
        }
        if (portOffset < Defaults.PORTS_PER_JOB || portOffset > Defaults.MAX_PORT_OFFSET) {
            throw new PortRangeException("Port offset must be between " + Defaults.PORTS_PER_JOB + " and "
                    + Defaults.MAX_PORT_OFFSET + ", got " + portOffset);
        }
        this.basePort = basePort;
        this.portOffset = portOffset;
    }

    public int basePort() {
        return basePort;
    }

    public int portOffset() {
        return portOffset;
    }

    public PortAllocation allocate(int jobIndex) {
        if (jobIndex < 0) {
            throw new PortRangeException("Job index must be non-negative, got " + jobIndex);
        }
        long automation = (long) basePort + (long) jobIndex * portOffset;
        long last = automation + Defaults.PORTS_PER_JOB - 1;
        if (last > Defaults.MAX_PORT) {
            throw new PortRangeException("Job index " + jobIndex + " would need port " + last
                    + ", above " + Defaults.MAX_PORT);
        }
        int port = (int) automation;
        return new PortAllocation(port, port + 1, port + 2);
    }

    public List<PortAllocation> allocateAll(int jobCount) {
        List<PortAllocation> out = new ArrayList<>(Math.max(0, jobCount));
        for (int i = 0; i < jobCount; i++) {
            out.add(allocate(i));
        }
        return out;
    }

    /**
     * Largest job count whose windows all fit below the top of the port range.
     */
    public int maxParallelJobs() {
        int usable = Defaults.MAX_PORT - basePort - (Defaults.PORTS_PER_JOB - 1);
        return usable < 0 ? 0 : usable / portOffset + 1;
    }

    public static boolean allDisjoint(Collection<PortAllocation> allocations) {
        Set<Integer> seen = new HashSet<>();
        for (PortAllocation allocation : allocations) {
            for (int port : allocation.ports()) {
                if (!seen.add(port)) {
                    return false;
                }
            }
        }
        return true;
    }
}
