package com.openrangelabs.donpetre.credentials.validation.probe;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProbeResponse {

    int status;
    String statusText;
    String contentType;
    String server;

    public boolean isOk() {
        return status >= 200 && status < 300;
    }
}
