package org.nowstart.dca.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

public class KrakenAuthRequestInterceptor implements RequestInterceptor {

    static final String PRIVATE_PATH_PREFIX = "/0/private/";

    private final KrakenSigner krakenSigner;
    private final LongSupplier nonceSource;
    private final AtomicLong lastNonce = new AtomicLong();

    public KrakenAuthRequestInterceptor(KrakenSigner krakenSigner) {
        this(krakenSigner, System::currentTimeMillis);
    }

    KrakenAuthRequestInterceptor(KrakenSigner krakenSigner, LongSupplier nonceSource) {
        this.krakenSigner = krakenSigner;
        this.nonceSource = nonceSource;
    }

    @Override
    public void apply(RequestTemplate template) {
        String path = template.path();
        if (path == null || !path.startsWith(PRIVATE_PATH_PREFIX)) {
            return;
        }

        long nonce = nextNonce();
        String postData = withNonce(nonce, currentBody(template));
        template.body(postData.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        template.header("API-Key", krakenSigner.getApiKey());
        template.header("API-Sign", krakenSigner.sign(path, nonce, postData));
        template.header("User-Agent", "kraken-dca/1.0");
    }

    private long nextNonce() {
        return lastNonce.updateAndGet(previous -> Math.max(previous + 1, nonceSource.getAsLong()));
    }

    private String currentBody(RequestTemplate template) {
        byte[] body = template.body();
        if (body == null || body.length == 0) {
            return "";
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    private String withNonce(long nonce, String form) {
        if (form.isBlank()) {
            return "nonce=" + nonce;
        }
        return "nonce=" + nonce + "&" + form;
    }
}
