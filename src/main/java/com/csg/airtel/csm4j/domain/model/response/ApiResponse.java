package com.csg.airtel.csm4j.domain.model.response;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
public class ApiResponse<T> {
    private Instant timestamp;
    private String message;
    private T data;

    public static <T> ApiResponse<T> of(String message, T data) {
        ApiResponse<T> response = new ApiResponse<>();
        response.setTimestamp(Instant.now());
        response.setMessage(message);
        response.setData(data);
        return response;
    }
}
