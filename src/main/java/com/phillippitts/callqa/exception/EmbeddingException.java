package com.phillippitts.callqa.exception;

/**
 * Thrown when an embedding provider fails to return vectors for a batch of keys.
 *
 * <p>Only raised inside the embedding pre-pass. The pre-pass retries, then degrades to a partial
 * map; callers of the clustering core never see this exception.
 */
public class EmbeddingException extends CallQaException {

    private final String providerName;
    private final int keyCount;

    public EmbeddingException(String message, String providerName, int keyCount) {
        super(message + " (provider: " + providerName + ", keys: " + keyCount + ")");
        this.providerName = providerName;
        this.keyCount = keyCount;
    }

    public EmbeddingException(String message, String providerName, int keyCount, Throwable cause) {
        super(message + " (provider: " + providerName + ", keys: " + keyCount + ")", cause);
        this.providerName = providerName;
        this.keyCount = keyCount;
    }

    public String getProviderName() {
        return providerName;
    }

    public int getKeyCount() {
        return keyCount;
    }
}
