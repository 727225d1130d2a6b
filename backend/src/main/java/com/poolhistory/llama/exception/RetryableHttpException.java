package com.poolhistory.llama.exception;

/** Marker exception indicating the HTTP call can be retried (429, 5xx, transport). */
public class RetryableHttpException extends RuntimeException {
    public RetryableHttpException(String message) { super(message); }
    public RetryableHttpException(String message, Throwable cause) { super(message, cause); }
}
