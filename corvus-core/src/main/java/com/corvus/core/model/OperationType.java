package com.corvus.core.model;

/**
 * The closed set of filesystem operations a task can perform.
 * Each {@link TaskKind} variant reports exactly one of these.
 */
public enum OperationType {
    COPY("copy"),
    MOVE("move"),
    DELETE("delete"),
    CREATE_FILE("create-file"),
    CREATE_DIRECTORY("create-directory"),
    CHMOD("chmod"),
    CHOWN("chown"),
    UNMOUNT("unmount"),
    ARCHIVE("archive");

    private final String tag;

    OperationType(String tag) {
        this.tag = tag;
    }

    /**
     * Short lowercase name used for log context and metric tags.
     */
    public String tag() {
        return tag;
    }
}
