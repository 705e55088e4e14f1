package com.ureca.campaign.changefeed.realtime;

/**
 * 방(room) 단위 브로드캐스트
 */
public interface RealtimeBroadcaster {

    void broadcast(String room, String eventName, RealtimeBatchPayload payload);
}
