package com.talksql;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TalkSqlApplication {

    public static void main(String[] args) {
        SpringApplication.run(TalkSqlApplication.class, args);
    }
}
