package com.ureca.campaign.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Slf4j
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String TOPIC_PREFIX = "/topic/";

    private final StompRelayProperties stompProps;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        if (stompProps.isRelayEnabled()) {
            registry.enableStompBrokerRelay("/topic")
                    .setRelayHost(stompProps.getHost())
                    .setRelayPort(stompProps.getPort())
                    .setClientLogin(stompProps.getClientLogin())
                    .setClientPasscode(stompProps.getClientPasscode())
                    .setSystemLogin(stompProps.getSystemLogin())
                    .setSystemPasscode(stompProps.getSystemPasscode());
            log.info("[WebSocket] STOMP 브로커 릴레이 사용. host: {}, port: {}",
                    stompProps.getHost(), stompProps.getPort());
        } else {
            registry.enableSimpleBroker("/topic");
            log.info("[WebSocket] 인메모리 SimpleBroker 사용");
        }

        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }
}
