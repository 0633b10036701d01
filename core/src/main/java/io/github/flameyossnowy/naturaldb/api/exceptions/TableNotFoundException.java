package io.github.flameyossnowy.naturaldb.api.exceptions;

public class TableNotFoundException extends NaturalDbException {
    public TableNotFoundException(String table) {
        super(ErrorCode.TABLE_NOT_FOUND, "Table does not exist: " + table);
        withTable(table);
    }
}
