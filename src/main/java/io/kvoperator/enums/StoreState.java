package io.kvoperator.enums;

/**
 * Store state as reported by the coordinator's store API.
 */
public enum StoreState {
    PREPARING,
    SERVING,
    REMOVING,
    REMOVED;

    /**
     * Maps the coordinator's state names, including the legacy Up/Offline/Tombstone names.
     */
    public static StoreState fromString(String value) {
        if (value == null) return null;

        switch (value.trim().toLowerCase()) {
            case "preparing":
                return PREPARING;
            case "up":
            case "serving":
                return SERVING;
            case "offline":
            case "removing":
                return REMOVING;
            case "tombstone":
            case "removed":
                return REMOVED;
            default:
                return null;
        }
    }
}
