package com.moviz.pipeline;

import java.util.List;

/**
 * A unified column: its canonical name, the source column names it may appear under, and its role.
 * Aliases are tried in order; the first one present in a dataset header wins.
 */
public class ColumnField {
    public final String fieldName;
    public final List<String> aliases;
    public final ColumnRole role;

    public ColumnField(String fieldName, List<String> aliases, ColumnRole role) {
        this.fieldName = fieldName;
        this.aliases = List.copyOf(aliases);
        this.role = role;
    }

    public boolean isCritical() {
        return role == ColumnRole.CRITICAL;
    }

    public boolean isNonCritical() {
        return role == ColumnRole.NON_CRITICAL;
    }

    @Override
    public String toString() {
        return fieldName + "(" + role + ")";
    }
}
