package com.fitcycle.backend.plan.web;

import lombok.Getter;

@Getter
public class SheetFetchException extends RuntimeException {

    private final int status;
    private final String bodySnippet;

    public SheetFetchException(int status, String message, String bodySnippet) {
        super(message);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

}
