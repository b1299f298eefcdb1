package fun.ai.indexer.exception;

public class CatalogEntryNotFoundException extends IndexerException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public CatalogEntryNotFoundException(Object key) {
        super(ERROR_CODE, "catalog entry not found: " + key);
    }
}
