package com.codefarm.shorturl;

import com.codefarm.shorturl.core.ExpiryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class ShortUrlApplication {

    private static final Logger log = LoggerFactory.getLogger(ShortUrlApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ShortUrlApplication.class, args);
    }

    @Bean
    ApplicationRunner startupBanner(Environment environment, ExpiryPolicy expiryPolicy) {
        return args -> log.info("URL shortener running on port {} (default validity {} min)",
                environment.getProperty("local.server.port", environment.getProperty("server.port", "8080")),
                expiryPolicy.defaultValidityMinutes());
    }
}
