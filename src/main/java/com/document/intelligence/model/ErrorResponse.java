package com.document.intelligence.model;

import lombok.Value;

@Value
public class ErrorResponse {

    String status;
    String message;

    public static ErrorResponse of(String message) {
        return new ErrorResponse("ERROR", message);
    }
}
