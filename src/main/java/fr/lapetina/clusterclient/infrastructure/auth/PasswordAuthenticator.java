package fr.lapetina.clusterclient.infrastructure.auth;

import fr.lapetina.clusterclient.domain.model.ServiceType;

/**
 * Same username and password for every service and endpoint.
 */
public final class PasswordAuthenticator implements Authenticator {

    private final String username;
    private final String password;

    public PasswordAuthenticator(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public Credentials credentials(ServiceType service, String endpoint) {
        return new Credentials(username, password);
    }

    @Override
    public String toString() {
        return "PasswordAuthenticator{username='" + username + "'}";
    }
}
