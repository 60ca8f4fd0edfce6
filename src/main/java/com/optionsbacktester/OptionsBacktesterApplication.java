package com.optionsbacktester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionsBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionsBacktesterApplication.class, args);
    }
}
