package com.alcance.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST) // Entrada malformada ou transição ilegal
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
