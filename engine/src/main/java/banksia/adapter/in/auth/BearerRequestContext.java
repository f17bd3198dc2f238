package banksia.adapter.in.auth;

import java.util.Optional;

import jakarta.enterprise.context.RequestScoped;

import banksia.core.model.token.Credential;

/**
 * The access token credential accepted for the current request.
 */
@RequestScoped
public class BearerRequestContext {

    private Credential credential;

    public void authenticated(Credential credential) {
        this.credential = credential;
    }

    public Optional<Credential> credential() {
        return Optional.ofNullable(credential);
    }
}
