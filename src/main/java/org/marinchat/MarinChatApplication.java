package org.marinchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// pas de comptes utilisateurs : le pseudo est fourni par le client
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class MarinChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(MarinChatApplication.class, args);
    }
}
