package in.optiontick.infrastructure.feed;

import java.net.URI;

/**
 * Exchanges a bearer credential for a one-time stream endpoint.
 */
@FunctionalInterface
public interface FeedAuthorizer {

    /**
     * @throws FeedAuthenticationException when no endpoint can be obtained
     */
    URI authorize(String accessToken);
}
