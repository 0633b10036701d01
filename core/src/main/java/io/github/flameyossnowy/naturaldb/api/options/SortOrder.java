package io.github.flameyossnowy.naturaldb.api.options;

public enum SortOrder {
    ASCENDING,
    DESCENDING;

    public static SortOrder of(boolean ascending) {
        return ascending ? ASCENDING : DESCENDING;
    }
}
