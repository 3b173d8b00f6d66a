package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectionTestResult {

    boolean success;
    Long responseTime;
    String error;
    Map<String, String> metadata;
}
