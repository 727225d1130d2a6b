package com.poolhistory.scd2;

/** Input rows are missing a key column (pool id, date) or repeat a key that must be unique. */
public class SchemaMismatchException extends RuntimeException {
    public SchemaMismatchException(String message) { super(message); }
    public SchemaMismatchException(String message, Throwable cause) { super(message, cause); }
}
