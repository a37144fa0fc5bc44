package com.vidnyan.dre;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DRE - Dynamic Request Engine
 *
 * Detects information gaps in running agents, spawns helper agents to fill them
 * and merges their findings back into the requester's context.
 */
@SpringBootApplication
public class DreApplication {

    public static void main(String[] args) {
        SpringApplication.run(DreApplication.class, args);
    }
}
