package io.memorybank.metadata;

public enum SortOrder {
    ASC,
    DESC
}
