package com.example.quotemonitor.notification;

import org.springframework.http.HttpMethod;
import org.springframework.web.util.UriUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Builds OAuth 1.0a {@code Authorization} headers (HMAC-SHA1, user context)
 * for requests whose body is not form-encoded, such as JSON posts.
 */
public class OAuth1Signer {

    private static final String SIGNATURE_METHOD = "HMAC-SHA1";
    private static final String MAC_ALGORITHM = "HmacSHA1";

    private final String consumerKey;
    private final String consumerSecret;
    private final String accessToken;
    private final String accessSecret;
    private final Clock clock;
    private final Supplier<String> nonceSupplier;

    public OAuth1Signer(String consumerKey, String consumerSecret, String accessToken, String accessSecret, Clock clock) {
        this(consumerKey, consumerSecret, accessToken, accessSecret, clock,
                () -> UUID.randomUUID().toString().replace("-", ""));
    }

    OAuth1Signer(String consumerKey, String consumerSecret, String accessToken, String accessSecret,
                 Clock clock, Supplier<String> nonceSupplier) {
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.accessToken = accessToken;
        this.accessSecret = accessSecret;
        this.clock = clock;
        this.nonceSupplier = nonceSupplier;
    }

    /**
     * Build the {@code Authorization} header value for a request
     *
     * @param method HTTP method
     * @param uri    absolute request URI; its query parameters are signed too
     */
    public String authorizationHeader(HttpMethod method, URI uri) {
        var oauthParams = new LinkedHashMap<String, String>();
        oauthParams.put("oauth_consumer_key", consumerKey);
        oauthParams.put("oauth_nonce", nonceSupplier.get());
        oauthParams.put("oauth_signature_method", SIGNATURE_METHOD);
        oauthParams.put("oauth_timestamp", String.valueOf(clock.instant().getEpochSecond()));
        oauthParams.put("oauth_token", accessToken);
        oauthParams.put("oauth_version", "1.0");

        var signedParams = new TreeMap<>(oauthParams);
        signedParams.putAll(queryParameters(uri));
        oauthParams.put("oauth_signature", sign(method.name(), baseUrl(uri), signedParams));

        return "OAuth " + oauthParams.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=\"" + encode(e.getValue()) + "\"")
                .collect(Collectors.joining(", "));
    }

    /**
     * Compute the signature over the given parameters
     *
     * @param method  upper-case HTTP method
     * @param baseUrl scheme, host and path of the request
     * @param params  every signed parameter (oauth_* and request parameters)
     */
    String sign(String method, String baseUrl, Map<String, String> params) {
        var normalized = params.entrySet().stream()
                .map(e -> Map.entry(encode(e.getKey()), encode(e.getValue())))
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));

        var baseString = method + "&" + encode(baseUrl) + "&" + encode(normalized);
        var signingKey = encode(consumerSecret) + "&" + encode(accessSecret);

        try {
            var mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), MAC_ALGORITHM));
            var digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA1 is not available", e);
        }
    }

    private static String baseUrl(URI uri) {
        var scheme = uri.getScheme().toLowerCase();
        var host = uri.getHost().toLowerCase();
        var port = uri.getPort();
        var defaultPort = ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
        var authority = (port == -1 || defaultPort) ? host : host + ":" + port;
        var path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return scheme + "://" + authority + UriUtils.decode(path, StandardCharsets.UTF_8);
    }

    private static Map<String, String> queryParameters(URI uri) {
        var params = new TreeMap<String, String>();
        var rawQuery = uri.getRawQuery();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (var pair : rawQuery.split("&")) {
            var idx = pair.indexOf('=');
            var key = idx < 0 ? pair : pair.substring(0, idx);
            var value = idx < 0 ? "" : pair.substring(idx + 1);
            params.put(UriUtils.decode(key, StandardCharsets.UTF_8), UriUtils.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static String encode(String value) {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }
}
