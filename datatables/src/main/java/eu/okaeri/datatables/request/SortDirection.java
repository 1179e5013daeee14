package eu.okaeri.datatables.request;

public enum SortDirection {
    ASC,
    DESC
}
