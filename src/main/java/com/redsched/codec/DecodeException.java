package com.redsched.codec;

/**
 * Stored text is not valid encoded content, or names a type the codec does not know.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
