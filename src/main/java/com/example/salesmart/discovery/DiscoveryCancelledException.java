package com.example.salesmart.discovery;

public class DiscoveryCancelledException extends RuntimeException {

    public DiscoveryCancelledException(String message) {
        super(message);
    }
}
