package io.github.flameyossnowy.naturaldb.api.exceptions;

public class RecordNotFoundException extends NaturalDbException {
    public RecordNotFoundException(String table, String recordId) {
        super(ErrorCode.RECORD_NOT_FOUND, "Record does not exist: " + recordId);
        withTable(table);
        withRecordId(recordId);
    }
}
