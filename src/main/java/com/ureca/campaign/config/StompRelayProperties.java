package com.ureca.campaign.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 외부 STOMP 브로커 릴레이 설정
 * relayEnabled 가 false 면 인메모리 SimpleBroker 사용
 */
@Data
@Component
@ConfigurationProperties(prefix = "custom.stomp")
public class StompRelayProperties {
    private boolean relayEnabled;
    private String host;
    private int port;
    private String clientLogin;
    private String clientPasscode;
    private String systemLogin;
    private String systemPasscode;
}
