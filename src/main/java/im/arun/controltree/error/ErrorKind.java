package im.arun.controltree.error;

/**
 * Fatal failure categories of a run. Each one aborts processing before any output is written.
 */
public enum ErrorKind {
    /** The source PDF is missing or cannot be opened. */
    SOURCE_UNAVAILABLE,

    /** Extraction produced no tables at all. */
    NO_TABLES_FOUND,

    /** No table carried the requirements column, or the column yielded no blobs. */
    NO_CONTENT_EXTRACTED,

    /** The destination file cannot be written. */
    OUTPUT_WRITE_FAILURE,

    /** The exporter input is missing or is not a control tree JSON document. */
    EXPORT_INPUT_INVALID
}
