package org.nowstart.dca.config;

import feign.RequestInterceptor;
import org.nowstart.dca.data.property.DcaProperties;
import org.nowstart.dca.service.auth.KrakenAuthRequestInterceptor;
import org.nowstart.dca.service.auth.KrakenSigner;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KrakenFeignConfig {

    @Bean
    @RefreshScope
    public KrakenSigner krakenSigner(DcaProperties dcaProperties) {
        return new KrakenSigner(dcaProperties.apiKey(), dcaProperties.apiSecret());
    }

    @Bean
    @RefreshScope
    public RequestInterceptor krakenAuthRequestInterceptor(KrakenSigner krakenSigner) {
        return new KrakenAuthRequestInterceptor(krakenSigner);
    }
}
