package com.updownbacktest.backtester.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private boolean success;
    private String error;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error);
    }
}
