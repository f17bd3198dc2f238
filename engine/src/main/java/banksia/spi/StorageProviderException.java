package banksia.spi;

/**
 * Thrown when no credential storage can be selected or a provider cannot
 * create its store. Surfaces at startup.
 */
public class StorageProviderException extends RuntimeException {

    private final String provider;

    public StorageProviderException(String provider, String message) {
        this(provider, message, null);
    }

    public StorageProviderException(String provider, String message, Throwable cause) {
        super(provider == null ? message : "[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    /**
     * @return the configured or failing provider name, null if none applies
     */
    public String provider() {
        return provider;
    }
}
