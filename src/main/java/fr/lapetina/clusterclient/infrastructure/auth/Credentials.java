package fr.lapetina.clusterclient.infrastructure.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Username and password handed out for one connection attempt or request.
 */
public record Credentials(String username, String password) {

    public Credentials {
        Objects.requireNonNull(username, "Username is required");
        Objects.requireNonNull(password, "Password is required");
    }

    /**
     * Value of an HTTP {@code Authorization} header.
     */
    public String basicAuthHeader() {
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * SASL PLAIN initial response: {@code \0username\0password}.
     */
    public byte[] saslPlain() {
        return ("\0" + username + "\0" + password).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Credentials{username='" + username + "', password=****}";
    }
}
