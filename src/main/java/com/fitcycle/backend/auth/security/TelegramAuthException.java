package com.fitcycle.backend.auth.security;

public class TelegramAuthException extends RuntimeException {

    public TelegramAuthException(String code) {
        super(code);
    }
}
