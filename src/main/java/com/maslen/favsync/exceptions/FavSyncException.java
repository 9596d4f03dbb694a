package com.maslen.favsync.exceptions;

import com.maslen.favsync.rest.ApiError;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public abstract class FavSyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final HttpStatus status;
    private final String errorCode;

    protected FavSyncException(HttpStatus status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public ApiError toApiError() {
        return new ApiError(status.value(), errorCode, getMessage());
    }
}
