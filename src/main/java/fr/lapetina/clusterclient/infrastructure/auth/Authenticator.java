package fr.lapetina.clusterclient.infrastructure.auth;

import fr.lapetina.clusterclient.domain.model.ServiceType;

/**
 * Supplies credentials per connection attempt.
 *
 * Called when a binary connection is established and for every HTTP request;
 * the returned credentials are not retained after that call.
 */
@FunctionalInterface
public interface Authenticator {

    /**
     * @param service  service being connected to
     * @param endpoint host:port of the target
     */
    Credentials credentials(ServiceType service, String endpoint);
}
