package com.openrangelabs.donpetre.credentials;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CredentialVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredentialVaultApplication.class, args);
    }

}
