package com.harvestlink.provenance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProvenanceVerifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProvenanceVerifierApplication.class, args);
    }
}
