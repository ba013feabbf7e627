package com.gdin.affinity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AffinityApplication {
    public static void main(String[] args) {
        SpringApplication.run(AffinityApplication.class, args);
    }
}
