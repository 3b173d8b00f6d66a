package com.openrangelabs.donpetre.credentials.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ImportResult {

    int success;
    int failed;
    List<ImportError> errors;

    @Value
    public static class ImportError {
        String key;
        String error;
    }
}
