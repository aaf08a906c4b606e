package org.nowstart.dca.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dca")
public record DcaProperties(
        // Kraken REST API 기본 URL
        @NotBlank @DefaultValue("https://api.kraken.com") String baseUrl,
        // Kraken API Key (API-Key 헤더)
        @DefaultValue("") String apiKey,
        // Kraken Private Key (base64, API-Sign 서명용)
        @DefaultValue("") String apiSecret,
        // 적립식 매수 대상 페어(정식 이름 또는 alt 이름, 예: XXBTZEUR / XBTEUR)
        @NotBlank @DefaultValue("XXBTZEUR") String pair,
        // 매수 주문 사이 최소 간격(일)
        @Positive @DefaultValue("1") int recurrenceDays,
        // 1회 매수 금액(quote 통화 기준)
        @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal amount,
        // 테이커 수수료율(예: 0.0026 = 0.26%)
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.0026") BigDecimal takerFeeRate,
        // 시스템 시각과 거래소 시각의 허용 오차
        @NotNull @DefaultValue("1s") Duration clockTolerance,
        // 스케줄러 실행 주기
        @NotNull @DefaultValue("1h") Duration interval
) {
}
