package io.kvoperator.enums;

/**
 * Role of a replica group.
 *
 * COORDINATOR: Raft quorum member holding cluster metadata, STORE: data-holding replica
 */
public enum InstanceRole {
    COORDINATOR("pd"),
    STORE("tikv");

    private final String shortName;

    InstanceRole(String shortName) {
        this.shortName = shortName;
    }

    /**
     * Name segment used when building instance names, e.g. {@code basic-pd-0}.
     */
    public String getShortName() {
        return shortName;
    }

    public static InstanceRole fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (InstanceRole role : InstanceRole.values()) {
            if (role.name().equalsIgnoreCase(trimmed) || role.shortName.equalsIgnoreCase(trimmed)) {
                return role;
            }
        }
        return null;
    }
}
