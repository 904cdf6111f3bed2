package com.example.securechat;

import com.example.securechat.config.ChatProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ChatProperties.class)
public class SecureChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureChatApplication.class, args);
    }
}
