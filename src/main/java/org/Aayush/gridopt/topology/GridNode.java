package org.Aayush.gridopt.topology;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Mutable node state owned by {@link GridTopology}. Identity, role and demand are fixed at
 * construction; only telemetry fields change.
 */
@Getter
@Accessors(fluent = true)
public final class GridNode {
    private final int id;
    private final String key;
    private final String name;
    private final NodeRole role;
    private final double demand;

    @Setter(AccessLevel.PACKAGE)
    private double voltage;
    @Setter(AccessLevel.PACKAGE)
    private double observedDemand;

    GridNode(int id, String key, String name, NodeRole role, double demand) {
        this.id = id;
        this.key = key;
        this.name = name;
        this.role = role;
        this.demand = role == NodeRole.GENERATOR ? 0.0d : demand;
        this.observedDemand = this.demand;
    }

    public boolean isGenerator() {
        return role == NodeRole.GENERATOR;
    }

    public boolean isSubstation() {
        return role == NodeRole.SUBSTATION;
    }
}
