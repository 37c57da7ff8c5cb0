package com.wraft.doc.build;

import com.wraft.doc.configuration.AppProperties;
import com.wraft.doc.exception.AssetUrlResolutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Signed asset URLs")
class SignedAssetUrlResolverTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private SignedAssetUrlResolver resolver;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getAssets().setSigningSecret("secret");
        appProperties.getAssets().setUrlTtl(Duration.ofMinutes(10));
        resolver = new SignedAssetUrlResolver(appProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should build a path under the prefix with expiry and signature")
    void resolve_shouldSignPathAndExpiry() {
        String url = resolver.resolve(new BuildSource.AssetRef("a1", "logo", "logo.png"));

        long expires = NOW.plus(Duration.ofMinutes(10)).getEpochSecond();
        String path = "/uploads/assets/a1/logo.png";
        assertThat(url).isEqualTo(path + "?expires=" + expires + "&signature=" + resolver.sign(path, expires));
    }

    @Test
    @DisplayName("Should encode file names")
    void resolve_shouldEncodeFileName() {
        String url = resolver.resolve(new BuildSource.AssetRef("a1", "logo", "company logo.png"));

        assertThat(url).startsWith("/uploads/assets/a1/company%20logo.png?");
    }

    @Test
    @DisplayName("Should produce different signatures for different expiries")
    void sign_shouldDependOnExpiry() {
        assertThat(resolver.sign("/p", 1)).isNotEqualTo(resolver.sign("/p", 2));
        assertThat(resolver.sign("/p", 1)).hasSize(64);
    }

    @Test
    @DisplayName("Should refuse an asset without a stored file")
    void resolve_withoutFile_shouldFail() {
        assertThrows(AssetUrlResolutionException.class,
                () -> resolver.resolve(new BuildSource.AssetRef("a1", "logo", " ")));
    }
}
