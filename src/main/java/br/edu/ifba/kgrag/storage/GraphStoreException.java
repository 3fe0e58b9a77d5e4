package br.edu.ifba.kgrag.storage;

/**
 * Graph store read or write failure.
 *
 * <p>The cause is kept so retry classification can look at the underlying
 * {@link java.sql.SQLException}.</p>
 */
public class GraphStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public GraphStoreException(String message, String key, Throwable cause) {
        super(key == null ? message : message + " [" + key + "]", cause);
        this.key = key;
    }

    public GraphStoreException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @return node id, rid or scope the operation was about, or null
     */
    public String getKey() {
        return key;
    }
}
