package com.maslen.favsync.service;

import lombok.Getter;

import java.io.IOException;

/**
 * The Bilibili web API answered with a non-zero {@code code}.
 */
@Getter
public class BilibiliApiException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int code;

    public BilibiliApiException(String endpoint, int code, String message) {
        super("Bilibili API " + endpoint + " returned code " + code + ": " + message);
        this.code = code;
    }
}
