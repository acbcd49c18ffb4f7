package com.elssolution.modemmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModemMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModemMonitorApplication.class, args);
    }

}
