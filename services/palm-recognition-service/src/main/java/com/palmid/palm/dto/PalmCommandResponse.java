package com.palmid.palm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.palmid.palm.domain.RegistrationSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result envelope of a palm command: register, recognize, delete or list.
 * {@code success} is false for domain failures; a recognized non-match is still a success.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "match", "message", "errorCode", "count", "records", "data"})
public class PalmCommandResponse {
    private boolean success;
    private Boolean match;
    private String message;
    private String errorCode;
    private Integer count;
    private List<RegistrationSummary> records;
    private Object data;

    public static PalmCommandResponse success(String message, Object data) {
        return PalmCommandResponse.builder()
            .success(true)
            .message(message)
            .data(data)
            .build();
    }

    public static PalmCommandResponse failure(String message, String errorCode) {
        return PalmCommandResponse.builder()
            .success(false)
            .message(message)
            .errorCode(errorCode)
            .build();
    }
}
