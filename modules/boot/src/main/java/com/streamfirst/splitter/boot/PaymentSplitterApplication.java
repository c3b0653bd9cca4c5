package com.streamfirst.splitter.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaymentSplitterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentSplitterApplication.class, args);
    }
}
