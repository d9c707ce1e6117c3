package com.tarterware.infrafinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InfrafinderApplication
{
    public static void main(String[] args)
    {
        SpringApplication.run(InfrafinderApplication.class, args);
    }
}
