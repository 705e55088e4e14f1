package com.ureca.campaign.changefeed.realtime;

import com.ureca.campaign.config.WebSocketConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * STOMP /topic/{room} 으로 전송
 * 이벤트 이름은 event-type 헤더로 전달
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompRealtimeBroadcaster implements RealtimeBroadcaster {

    public static final String EVENT_TYPE_HEADER = "event-type";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void broadcast(String room, String eventName, RealtimeBatchPayload payload) {
        String destination = WebSocketConfig.TOPIC_PREFIX + room;
        messagingTemplate.convertAndSend(destination, payload, Map.<String, Object>of(EVENT_TYPE_HEADER, eventName));

        log.debug("[실시간 브로드캐스트] 전송 완료. destination: {}, event: {}, count: {}",
                destination, eventName, payload.events().size());
    }
}
