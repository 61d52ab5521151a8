package com.optiondesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionDeskApplication.class, args);
    }
}
