package com.example.nl2cmd;

import com.example.nl2cmd.config.Nl2CmdProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(Nl2CmdProperties.class)
public class Nl2CmdApplication {

    public static void main(String[] args) {
        SpringApplication.run(Nl2CmdApplication.class, args);
    }
}
