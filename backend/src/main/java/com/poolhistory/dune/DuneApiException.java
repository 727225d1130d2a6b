package com.poolhistory.dune;

/** A Dune table API call failed. */
public class DuneApiException extends RuntimeException {
    public DuneApiException(String message) { super(message); }
    public DuneApiException(String message, Throwable cause) { super(message, cause); }
}
