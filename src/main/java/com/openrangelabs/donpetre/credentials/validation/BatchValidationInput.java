package com.openrangelabs.donpetre.credentials.validation;

import lombok.Value;

/**
 * One entry of a batch. {@code provider} is a tag and may be unknown, in which case the
 * entry fails validation without aborting the batch.
 */
@Value
public class BatchValidationInput {

    String id;
    String key;
    String provider;

    @Override
    public String toString() {
        return "BatchValidationInput(id=" + id + ", provider=" + provider + ")";
    }
}
