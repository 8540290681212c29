package io.shotmatrix.model;

import java.util.List;

/**
 * Ports reserved for one job. Only one auxiliary port is used per platform, both are reserved.
 */
public record PortAllocation(
        int automationPort,
        int iosAuxPort,
        int androidAuxPort
) {
    public List<Integer> ports() {
        return List.of(automationPort, iosAuxPort, androidAuxPort);
    }

    public int auxPortFor(Platform platform) {
        return platform == Platform.IOS ? iosAuxPort : androidAuxPort;
    }

    public boolean overlaps(PortAllocation other) {
        if (other == null) {
            return false;
        }
        for (int port : ports()) {
            if (other.ports().contains(port)) {
                return true;
            }
        }
        return false;
    }
}
