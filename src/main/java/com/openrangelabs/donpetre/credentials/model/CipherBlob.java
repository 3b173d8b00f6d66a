package com.openrangelabs.donpetre.credentials.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of a single encryption: cipher bytes, the IV used, the algorithm tag and the
 * payload schema version. Byte arrays serialize as base64.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CipherBlob {

    private byte[] cipher;
    private byte[] iv;
    private String algorithm;
    private int version;
}
