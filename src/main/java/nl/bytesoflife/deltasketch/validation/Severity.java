package nl.bytesoflife.deltasketch.validation;

public enum Severity {
    /** Blocks validity. */
    ERROR,
    /** Advisory only. */
    WARNING
}
