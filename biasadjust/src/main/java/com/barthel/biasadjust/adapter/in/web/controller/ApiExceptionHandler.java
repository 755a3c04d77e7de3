package com.barthel.biasadjust.adapter.in.web.controller;

import com.barthel.biasadjust.adapter.in.web.dto.ErrorResponseDto;
import com.barthel.biasadjust.domain.exception.KindNotSupportedException;
import com.barthel.biasadjust.domain.exception.UnknownMethodException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected adjustment requests to 400 responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(UnknownMethodException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponseDto unknownMethod(UnknownMethodException e) {
        return reject("unknown_method", e);
    }

    @ExceptionHandler({KindNotSupportedException.class, UnsupportedOperationException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponseDto notSupported(RuntimeException e) {
        return reject("not_supported", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponseDto invalidArgument(IllegalArgumentException e) {
        return reject("invalid_argument", e);
    }

    private ErrorResponseDto reject(String error, RuntimeException e) {
        log.info("Rejected request ({}): {}", error, e.getMessage());
        return new ErrorResponseDto(error, e.getMessage());
    }
}
