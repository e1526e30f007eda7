package dev.careerpath.ai;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class DisabledTextClientTest {

    private final DisabledTextClient client = new DisabledTextClient();

    @Test
    void shouldBeDisabled() {
        assertThat(client.isEnabled()).isFalse();
        assertThat(client.getName()).isEqualTo("none");
    }

    @Test
    void shouldFailEveryCallWithAuthError() {
        StepVerifier.create(client.generate("prompt", null))
                .expectErrorSatisfies(e -> assertThat(((ExternalServiceException) e).getKind())
                        .isEqualTo(ExternalServiceException.Kind.AUTH_ERROR))
                .verify();

        StepVerifier.create(client.generateJson("prompt", null))
                .expectErrorSatisfies(e -> assertThat(((ExternalServiceException) e).isRetryable()).isFalse())
                .verify();
    }
}
