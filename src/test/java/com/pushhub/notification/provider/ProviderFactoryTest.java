package com.pushhub.notification.provider;

import com.pushhub.notification.config.HubConfig;
import com.pushhub.notification.retry.RetryExecutor;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ProviderFactoryTest {

    private static final String FIREBASE_CREDENTIALS =
            "client-email = \"" + ServiceAccountKeys.CLIENT_EMAIL + "\", private-key = \"" + ServiceAccountKeys.escapedPem() + "\"";

    private final RetryExecutor retry = new RetryExecutor(1, 0L, ms -> { });

    private final List<NotificationProvider> built = new ArrayList<>();

    @AfterEach
    void teardown() {
        built.forEach(NotificationProvider::close);
    }

    @Test
    void buildProviders_createsEnabledProviders_withConfiguredPriority() {
        final var providers = build("providers = [\n"
                + "  { name = \"pusher\",    enabled = true,  priority = 3, app-id = \"a\", key = \"k\", secret = \"s\", cluster = \"eu\" }\n"
                + "  { name = \"firebase\",  enabled = true,  priority = 1, project-id = \"p\", " + FIREBASE_CREDENTIALS + " }\n"
                + "  { name = \"onesignal\", enabled = false, priority = 2, app-id = \"a\", rest-api-key = \"r\" }\n"
                + "]\n");

        assertThat(providers).hasSize(2);
        assertThat(providers.get(0)).isInstanceOf(PusherProvider.class);
        assertThat(providers.get(0).priority()).isEqualTo(3);
        assertThat(providers.get(1)).isInstanceOf(FirebaseProvider.class);
        assertThat(providers.get(1).priority()).isEqualTo(1);
        assertThat(providers).allMatch(NotificationProvider::isEnabled);
    }

    @Test
    void buildProviders_fallsBackToDeclarationOrder_whenPriorityMissing() {
        final var providers = build("providers = [\n"
                + "  { name = \"OneSignal\", enabled = true, app-id = \"a\", rest-api-key = \"r\" }\n"
                + "  { name = \"Firebase\",  enabled = true, project-id = \"p\", " + FIREBASE_CREDENTIALS + " }\n"
                + "]\n");

        assertThat(providers).extracting(NotificationProvider::name).containsExactly("OneSignal", "Firebase");
        assertThat(providers).extracting(NotificationProvider::priority).containsExactly(1, 2);
    }

    @Test
    void buildProviders_keepsProviderWithMissingCredentials_asDisabled() {
        final var providers = build("providers = [\n"
                + "  { name = \"firebase\", enabled = true, project-id = \"p\", client-email = \"" + ServiceAccountKeys.CLIENT_EMAIL + "\", private-key = \"\" }\n"
                + "]\n");

        assertThat(providers).hasSize(1);
        assertThat(providers.get(0).isEnabled()).isFalse();
    }

    @Test
    void buildProviders_readsFirebaseServiceAccount_withDefaultTokenUri() {
        final var providers = build("providers = [\n"
                + "  { name = \"firebase\", enabled = true, project-id = \"demo\", " + FIREBASE_CREDENTIALS + ", token-uri = \"\" }\n"
                + "]\n");

        assertThat(providers).hasSize(1);
        assertThat(providers.get(0)).isInstanceOf(FirebaseProvider.class);
        assertThat(providers.get(0).isEnabled()).isTrue();
    }

    @Test
    void buildProviders_skipsUnknownProviderNames() {
        final var providers = build("providers = [\n"
                + "  { name = \"carrier-pigeon\", enabled = true }\n"
                + "  { name = \"onesignal\",      enabled = true, app-id = \"a\", rest-api-key = \"r\" }\n"
                + "]\n");

        assertThat(providers).extracting(NotificationProvider::name).containsExactly("OneSignal");
    }

    private List<NotificationProvider> build(final String hocon) {
        final var config = HubConfig.from(ConfigFactory.parseString(hocon));
        final var providers = ProviderFactory.buildProviders(config, retry);
        built.addAll(providers);
        return providers;
    }
}
