package de.htwsaar.streamrelay.relay;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import de.htwsaar.streamrelay.common.logging.LoggingConfig;
import de.htwsaar.streamrelay.relay.config.RefererTable;
import de.htwsaar.streamrelay.relay.domain.CredentialCandidate;
import de.htwsaar.streamrelay.relay.service.RetryPolicy;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

/**
 * Verifiziert die Verdrahtung der Relay-Applikation über Annotationen und Bean-Methoden.
 */
class RelayAppWiringTest {

    @Test
    void shouldImportSharedLoggingConfig() {
        Import importAnnotation = RelayApp.class.getAnnotation(Import.class);
        assertNotNull(importAnnotation);
        assertArrayEquals(new Class<?>[] {LoggingConfig.class}, importAnnotation.value());
    }

    @Test
    void shouldBeBoundToRelayProfile() {
        Profile profile = RelayApp.class.getAnnotation(Profile.class);
        assertNotNull(profile);
        assertArrayEquals(new String[] {"relay"}, profile.value());

        Profile beansProfile = RelayBeans.class.getAnnotation(Profile.class);
        assertNotNull(beansProfile);
        assertArrayEquals(new String[] {"relay"}, beansProfile.value());
    }

    @Test
    void refererTableBeanAppliesConfiguredDefault() {
        RefererTable table = new RelayBeans().refererTable(" https://default.test/ ");
        assertEquals("https://default.test/", table.defaultReferer());
        assertEquals(RefererTable.defaults().rules(), table.rules());
    }

    @Test
    void retryPolicyBeanIgnoresBlankEntries() {
        RetryPolicy policy = new RelayBeans().retryPolicy(List.of("https://a.test/", " ", "https://b.test/"));
        assertEquals(
                4,
                policy.initialAndFallbacks(URI.create("https://cdn.test/x.ts"), new CredentialCandidate("https://z.test/"))
                        .size());
    }
}
