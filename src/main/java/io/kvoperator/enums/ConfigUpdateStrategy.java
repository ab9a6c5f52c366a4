package io.kvoperator.enums;

/**
 * How a configuration-only template change reaches running instances.
 */
public enum ConfigUpdateStrategy {
    /** Push the new configuration without restarting the instance. */
    HOT_RELOAD,
    /** Roll the instance like a version change. */
    RESTART
}
