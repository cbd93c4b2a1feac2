package io.fullerstack.performance.core.model;

public enum BottleneckType {
    CPU,
    MEMORY,
    DISK,
    NETWORK,
    DATABASE,
    APPLICATION
}
