package com.ureca.campaign.changefeed.scheduler;

import com.ureca.campaign.changefeed.dto.ChangeFeedPollResult;
import com.ureca.campaign.changefeed.service.ChangeFeedDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeFeedPollingScheduler 단위 테스트")
class ChangeFeedPollingSchedulerTest {

    @InjectMocks
    private ChangeFeedPollingScheduler scheduler;

    @Mock
    private ChangeFeedDispatcher dispatcher;

    @Test
    @DisplayName("성공 : 주기마다 폴링 1회")
    void poll_delegates() {
        // given
        given(dispatcher.pollOnce()).willReturn(ChangeFeedPollResult.skipped());

        // when
        scheduler.poll();

        // then
        verify(dispatcher).pollOnce();
    }

    @Test
    @DisplayName("실패 : 저장소 장애 -> 이번 주기만 포기, 예외 전파 없음")
    void poll_storageFailure() {
        // given
        given(dispatcher.pollOnce()).willThrow(new DataAccessResourceFailureException("DB 연결 실패"));
        given(dispatcher.getLastProcessedId()).willReturn(42L);

        // when, then
        assertThatCode(() -> scheduler.poll()).doesNotThrowAnyException();
    }
}
