package com.voxell.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * VoxellAuthApplication - Main entry point for the Voxell DLC authentication service.
 *
 * This service is responsible for:
 * - Player registration with email, password and nickname
 * - Email/password login issuing stateless bearer tokens
 * - Resolving a bearer token back to the player's public profile
 *
 * Architecture Context:
 * - Runs on port 8000 by default (PORT environment variable, see application.yml)
 * - Connects to PostgreSQL for player persistence (DATABASE_URL)
 * - Stateless design - identity is carried by HMAC-SHA256 signed JWTs
 *
 * @see com.voxell.auth.controller.AuthController for REST endpoint definitions
 * @see com.voxell.auth.service.AuthService for business logic implementation
 * @see com.voxell.auth.security.TokenCodec for token operations
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VoxellAuthApplication {

    /**
     * Application entry point.
     *
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(VoxellAuthApplication.class, args);
    }
}
