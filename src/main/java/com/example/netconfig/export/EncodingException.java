package com.example.netconfig.export;

public class EncodingException extends RuntimeException {

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
