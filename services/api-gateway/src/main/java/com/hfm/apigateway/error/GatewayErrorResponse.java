package com.hfm.apigateway.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body produced by the gateway itself (never by a backend).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayErrorResponse {

    private String timestamp;
    private Integer status;
    private String error;
    private String message;
    private String path;
    private String service;
}
