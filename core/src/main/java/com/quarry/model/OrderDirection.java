package com.quarry.model;

/**
 * Sort direction of an {@code order_by} entry.
 */
public enum OrderDirection {
    ASC,
    DESC
}
