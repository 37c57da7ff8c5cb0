package com.wraft.doc.build;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.wraft.doc.configuration.AppProperties;
import com.wraft.doc.configuration.AssetProperties;
import com.wraft.doc.exception.AssetUrlResolutionException;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Signed, time limited URLs for locally stored assets:
 * {@code <prefix>/<asset uuid>/<file>?expires=<epoch seconds>&signature=<hmac>}.
 *
 * The signature is HMAC-SHA256 over {@code "<path>:<expires>"}.
 */
@Component
public class SignedAssetUrlResolver implements AssetUrlResolver {

    private final AssetProperties props;
    private final Clock clock;
    private final HashFunction hmac;

    public SignedAssetUrlResolver(AppProperties appProperties, Clock clock) {
        this.props = appProperties.getAssets();
        this.clock = clock;
        this.hmac = Hashing.hmacSha256(props.getSigningSecret().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String resolve(BuildSource.AssetRef asset) {
        if (asset.file() == null || asset.file().isBlank()) {
            throw new AssetUrlResolutionException("Asset '" + asset.name() + "' has no stored file");
        }

        String path = props.getUrlPrefix() + "/" + asset.uuid() + "/"
                + URLEncoder.encode(asset.file(), StandardCharsets.UTF_8).replace("+", "%20");
        long expires = clock.instant().plus(props.getUrlTtl()).getEpochSecond();

        return path + "?expires=" + expires + "&signature=" + sign(path, expires);
    }

    String sign(String path, long expires) {
        return hmac.hashString(path + ":" + expires, StandardCharsets.UTF_8).toString();
    }
}
