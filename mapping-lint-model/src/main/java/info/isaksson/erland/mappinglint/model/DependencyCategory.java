package info.isaksson.erland.mappinglint.model;

/** What kind of external work a dependency-shaped call performs. */
public enum DependencyCategory {
    DATA_ACCESS("a database query"),
    REMOTE_CALL("a remote service call"),
    FILE_IO("a file I/O operation"),
    REFLECTION("a reflection operation");

    private final String description;

    DependencyCategory(String description) {
        this.description = description;
    }

    /** Phrase used inside diagnostic messages. */
    public String description() {
        return description;
    }
}
