package com.positionengine.unit.lookup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.positionengine.config.ClassificationConfig;
import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.model.SecurityProfile;
import com.positionengine.exception.SecurityLookupException;
import com.positionengine.lookup.FmpSecurityLookupClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * Tests for FmpSecurityLookupClient against a mocked FMP profile endpoint.
 */
class FmpSecurityLookupClientTest {

    private static final String PROFILE_URL = "https://fmp.test/stable/profile?symbol=ZZZ&apikey=test-key";

    private MockRestServiceServer server;
    private FmpSecurityLookupClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://fmp.test");
        server = MockRestServiceServer.bindTo(builder).build();
        ClassificationConfig config = new ClassificationConfig();
        config.getFmp().setApiKey("test-key");
        client = new FmpSecurityLookupClient(builder.build(), config);
    }

    @Nested
    @DisplayName("Profile mapping")
    class ProfileMapping {

        @Test
        @DisplayName("ETF flag maps to ETF")
        void etfProfile() {
            server.expect(requestTo(PROFILE_URL))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(
                            "[{\"symbol\":\"ZZZ\",\"companyName\":\"Zeta Total Market ETF\",\"exchange\":\"NYSE ARCA\","
                                    + "\"isEtf\":true,\"isFund\":false}]",
                            MediaType.APPLICATION_JSON));

            SecurityProfile profile = client.lookup("ZZZ");

            assertThat(profile.isEtf()).isTrue();
            assertThat(profile.isCashMarker()).isFalse();
            assertThat(profile.getExchange()).isEqualTo("NYSE ARCA");
            assertThat(profile.toSecurityType()).isEqualTo(SecurityType.ETF);
            server.verify();
        }

        @Test
        @DisplayName("Fund flag maps to mutual fund")
        void fundProfile() {
            server.expect(requestTo(PROFILE_URL))
                    .andRespond(withSuccess("[{\"symbol\":\"ZZZ\",\"isEtf\":false,\"isFund\":true}]",
                            MediaType.APPLICATION_JSON));

            assertThat(client.lookup("ZZZ").toSecurityType()).isEqualTo(SecurityType.MUTUAL_FUND);
        }

        @Test
        @DisplayName("Operating company maps to equity")
        void companyProfile() {
            server.expect(requestTo(PROFILE_URL))
                    .andRespond(withSuccess("[{\"symbol\":\"ZZZ\",\"companyName\":\"Zeta Corp\"}]",
                            MediaType.APPLICATION_JSON));

            assertThat(client.lookup("ZZZ").toSecurityType()).isEqualTo(SecurityType.EQUITY);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Server error is retryable")
        void serverErrorRetryable() {
            server.expect(requestTo(PROFILE_URL)).andRespond(withServerError());

            assertThatThrownBy(() -> client.lookup("ZZZ"))
                    .isInstanceOfSatisfying(SecurityLookupException.class, e -> {
                        assertThat(e.isRetryable()).isTrue();
                        assertThat(e.getTicker()).isEqualTo("ZZZ");
                    });
        }

        @Test
        @DisplayName("Rate limiting is retryable")
        void rateLimitRetryable() {
            server.expect(requestTo(PROFILE_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

            assertThatThrownBy(() -> client.lookup("ZZZ"))
                    .isInstanceOfSatisfying(SecurityLookupException.class, e -> assertThat(e.isRetryable()).isTrue());
        }

        @Test
        @DisplayName("Client error other than 429 is not retryable")
        void notFoundNotRetryable() {
            server.expect(requestTo(PROFILE_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThatThrownBy(() -> client.lookup("ZZZ"))
                    .isInstanceOfSatisfying(SecurityLookupException.class, e -> assertThat(e.isRetryable()).isFalse());
        }

        @Test
        @DisplayName("Empty profile array is an unknown symbol")
        void emptyArrayNotRetryable() {
            server.expect(requestTo(PROFILE_URL)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.lookup("ZZZ"))
                    .isInstanceOfSatisfying(SecurityLookupException.class, e -> {
                        assertThat(e.isRetryable()).isFalse();
                        assertThat(e.getMessage()).contains("no profile");
                    });
        }
    }
}
