package banksia.adapter.in.rest;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import banksia.core.model.oauth.EndpointResponse;

/**
 * Converts {@link EndpointResponse}s into JAX-RS responses.
 */
public final class EndpointResponses {

    private EndpointResponses() {}

    public static Response toResponse(EndpointResponse response) {
        if (response instanceof EndpointResponse.Redirect redirect) {
            // set the raw header so the encoded parameters are sent unchanged
            return Response.status(redirect.status())
                    .header(HttpHeaders.LOCATION, redirect.location())
                    .build();
        }
        if (response instanceof EndpointResponse.Json json) {
            final var builder = Response.status(json.status()).type(MediaType.APPLICATION_JSON_TYPE);
            json.headers().forEach(builder::header);
            return builder.entity(json.body()).build();
        }
        if (response instanceof EndpointResponse.Text text) {
            return Response.status(text.status())
                    .type(MediaType.TEXT_PLAIN_TYPE)
                    .entity(text.body())
                    .build();
        }
        final var empty = (EndpointResponse.Empty) response;
        final var builder = Response.status(empty.status());
        empty.headers().forEach(builder::header);
        return builder.build();
    }
}
