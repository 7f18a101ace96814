package federa.common.message;

/**
 * A record that can be stored by name in a {@link Content}.
 */
public interface ContentRecord {

    /** Kind of this record, used by storage codecs. */
    Kind kind();

    enum Kind {
        CONFIGS,
        METRICS,
        PARAMETERS
    }
}
