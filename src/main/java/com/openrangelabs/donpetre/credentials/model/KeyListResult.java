package com.openrangelabs.donpetre.credentials.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class KeyListResult {

    List<CredentialMetadata> keys;
    int total;
    boolean hasMore;
    String nextCursor;
}
