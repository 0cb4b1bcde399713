package uz.greenwhite.deviceauth.credential;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.model.TokenSet;
import uz.greenwhite.deviceauth.support.TestProperties;
import uz.greenwhite.deviceauth.support.VirtualClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CredentialHolder")
class CredentialHolderTest {

    private DeviceAuthProperties properties;
    private VirtualTimeScheduler scheduler;
    private CredentialHolder holder;

    @BeforeEach
    void setUp() {
        properties = TestProperties.valid();
        scheduler = VirtualTimeScheduler.create();
        holder = new CredentialHolder(properties, new VirtualClock(scheduler));
    }

    @Nested
    @DisplayName("store")
    class Store {

        @Test
        @DisplayName("should start empty")
        void shouldStartEmpty() {
            assertThat(holder.hasAccessToken()).isFalse();
            assertThat(holder.snapshot().accessToken()).isNull();
            assertThat(holder.isAccessTokenExpired()).isTrue();
        }

        @Test
        @DisplayName("should overwrite fields present in the new token set")
        void shouldOverwritePresentFields() {
            holder.store(new TokenSet("first", "Bearer", 3600L, "rt", "id1"));
            holder.store(new TokenSet("second", null, 1800L, null, null));

            TokenSet snapshot = holder.snapshot();
            assertThat(snapshot.accessToken()).isEqualTo("second");
            assertThat(snapshot.tokenType()).isEqualTo("Bearer");
            assertThat(snapshot.expiresInSeconds()).isEqualTo(1800L);
            assertThat(snapshot.idToken()).isEqualTo("id1");
        }

        @Test
        @DisplayName("should retain the refresh token when the response omits it")
        void shouldRetainRefreshToken() {
            holder.store(new TokenSet("first", "Bearer", 3600L, "rt", null));
            holder.store(new TokenSet("second", "Bearer", 3600L, null, null));

            assertThat(holder.getRefreshToken()).isEqualTo("rt");
            assertThat(properties.getRefreshToken()).isEqualTo("rt");
        }

        @Test
        @DisplayName("should expose a new refresh token through the configuration")
        void shouldSyncRefreshTokenToConfiguration() {
            properties.setRefreshToken("old");

            holder.store(new TokenSet("tok", "Bearer", 3600L, "rt", null));

            assertThat(properties.getRefreshToken()).isEqualTo("rt");
            assertThat(holder.snapshot().refreshToken()).isEqualTo("rt");
        }

        @Test
        @DisplayName("should forget a discarded refresh token")
        void shouldDiscardRefreshToken() {
            holder.store(new TokenSet("tok", "Bearer", 3600L, "rt", null));

            holder.discardRefreshToken();

            assertThat(holder.getRefreshToken()).isNull();
            assertThat(properties.hasRefreshToken()).isFalse();
        }
    }

    @Nested
    @DisplayName("isAccessTokenExpired")
    class IsAccessTokenExpired {

        @Test
        @DisplayName("should report expiry 15 seconds before expires_in elapses")
        void shouldApplyMargin() {
            holder.store(new TokenSet("tok", "Bearer", 60L, null, null));

            scheduler.advanceTimeBy(Duration.ofSeconds(44));
            assertThat(holder.isAccessTokenExpired()).isFalse();

            scheduler.advanceTimeBy(Duration.ofSeconds(2));
            assertThat(holder.isAccessTokenExpired()).isTrue();
        }

        @Test
        @DisplayName("should treat a token without expires_in as valid")
        void shouldTreatMissingExpiryAsValid() {
            holder.store(new TokenSet("tok", "Bearer", null, null, null));

            scheduler.advanceTimeBy(Duration.ofDays(1));

            assertThat(holder.isAccessTokenExpired()).isFalse();
        }
    }

    @Test
    @DisplayName("should build the Authorization header from the token type")
    void shouldBuildAuthorizationHeader() {
        holder.store(new TokenSet("tok", "bearer", 3600L, null, null));
        assertThat(holder.getAuthorizationHeader()).isEqualTo("Bearer tok");

        holder.store(new TokenSet("mac-tok", "MAC", 3600L, null, null));
        assertThat(holder.getAuthorizationHeader()).isEqualTo("MAC mac-tok");
    }
}
