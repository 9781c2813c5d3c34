package com.schoolsched.schoolsched_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// No local user store: callers present tokens issued elsewhere
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class SchoolschedApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchoolschedApiApplication.class, args);
    }

}
