package com.poolhistory.dune;

/** Column of a Dune uploaded table; type is a Dune SQL type name (varchar, double, date, boolean...). */
public record DuneColumn(String name, String type, boolean nullable) {

    public static DuneColumn of(String name, String type) {
        return new DuneColumn(name, type, true);
    }
}
