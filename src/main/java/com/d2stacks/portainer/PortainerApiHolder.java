package com.d2stacks.portainer;

import java.util.Objects;

/**
 * Holds the client every repository talks through. A successful login produces a new
 * {@link PortainerApi}; {@link #adopt} makes it the current one.
 */
public class PortainerApiHolder {

    private volatile PortainerApi current;

    public PortainerApiHolder(PortainerApi initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    public PortainerApi current() {
        return current;
    }

    public void adopt(PortainerApi api) {
        this.current = Objects.requireNonNull(api, "api");
    }
}
