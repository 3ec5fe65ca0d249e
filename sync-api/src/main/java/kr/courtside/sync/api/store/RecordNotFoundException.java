package kr.courtside.sync.api.store;

public class RecordNotFoundException extends StoreException {

    private final String recordId;

    public RecordNotFoundException(String recordId) {
        super("record not found: " + recordId);
        this.recordId = recordId;
    }

    public String recordId() {
        return recordId;
    }
}
