package peroxo.chat.cache.store;

public class StorageQuotaExceededException extends StorageException {

    public StorageQuotaExceededException(String message) {
        super(message);
    }

    public StorageQuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
