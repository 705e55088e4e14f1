package com.ureca.campaign.schedule.controller;

import com.ureca.campaign.schedule.calculator.ScheduleWindow;
import com.ureca.campaign.schedule.calculator.ScheduleWindowDetails;
import com.ureca.campaign.schedule.dto.CreateDepartmentScheduleRequest;
import com.ureca.campaign.schedule.dto.DepartmentScheduleResponse;
import com.ureca.campaign.schedule.dto.ScheduleWindowResponse;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.exception.DepartmentScheduleNotFoundException;
import com.ureca.campaign.schedule.exception.ScheduleConfigurationException;
import com.ureca.campaign.schedule.service.DepartmentScheduleService;
import com.ureca.campaign.support.fixture.DepartmentScheduleFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * DepartmentScheduleController 슬라이스 테스트
 * <p>
 * - 요청 본문 검증 실패 / 필수 헤더 누락 -> 400 INVALID_INPUT
 * - 스케줄 설정 오류 -> 400 INVALID_SCHEDULE_CONFIG
 * - 없는 스케줄 -> 404
 * - 응답 포맷 (status, message, data)
 */
@WebMvcTest(DepartmentScheduleController.class)
class DepartmentScheduleControllerTest {

    private static final String BASE_URL = "/api/department-schedules";

    private static final String VALID_CREATE_BODY = """
            {
              "name": "5월 상담 일정",
              "scheduleType": "DAILY_DATES",
              "scheduleConfig": {
                "type": "daily_dates",
                "dates": [{"day_of_month": 10, "month": 5, "year": 2024}]
              },
              "departmentId": 10
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DepartmentScheduleService scheduleService;

    private DepartmentScheduleResponse response() {
        return DepartmentScheduleResponse.from(DepartmentScheduleFixture.scheduleWithId(
                1L, DepartmentScheduleFixture.mayDates(), ScheduleStatus.ACTIVE));
    }

    @Nested
    @DisplayName("POST /api/department-schedules")
    class CreateTest {

        @Test
        @DisplayName("성공 : 201 과 생성된 스케줄 반환")
        void create_success() throws Exception {
            // given
            given(scheduleService.create(any(CreateDepartmentScheduleRequest.class), eq(100L))).willReturn(response());

            // when, then
            mockMvc.perform(post(BASE_URL)
                            .header(DepartmentScheduleSwagger.USER_ID_HEADER, 100L)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_CREATE_BODY))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("DEPARTMENT_SCHEDULE_CREATE_SUCCESS_201"))
                    .andExpect(jsonPath("$.data.id").value(1))
                    .andExpect(jsonPath("$.data.scheduleConfig.type").value("daily_dates"))
                    .andExpect(jsonPath("$.data.scheduleConfig.dates[0].day_of_month").value(10));
        }

        @Test
        @DisplayName("예외 : 이름 누락 -> 400 INVALID_INPUT, 서비스 호출 없음")
        void create_missingName() throws Exception {
            // given
            String body = """
                    {
                      "scheduleType": "DAILY_DATES",
                      "scheduleConfig": {"type": "daily_dates", "dates": [{"day_of_month": 10}]},
                      "departmentId": 10
                    }
                    """;

            // when, then
            mockMvc.perform(post(BASE_URL)
                            .header(DepartmentScheduleSwagger.USER_ID_HEADER, 100L)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.status").value("INVALID_INPUT_400"))
                    .andExpect(jsonPath("$.message").value("스케줄 이름은 필수입니다."));

            verify(scheduleService, never()).create(any(), any());
        }

        @Test
        @DisplayName("예외 : 사용자 헤더 누락 -> 400")
        void create_missingUserHeader() throws Exception {
            mockMvc.perform(post(BASE_URL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_CREATE_BODY))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.status").value("INVALID_INPUT_400"));
        }

        @Test
        @DisplayName("예외 : 알 수 없는 설정 type -> 400 (본문 해석 실패)")
        void create_unknownConfigType() throws Exception {
            // given
            String body = VALID_CREATE_BODY.replace("\"daily_dates\"", "\"weekly\"");

            // when, then
            mockMvc.perform(post(BASE_URL)
                            .header(DepartmentScheduleSwagger.USER_ID_HEADER, 100L)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.status").value("INVALID_INPUT_400"));
        }

        @Test
        @DisplayName("예외 : 설정 검증 실패 -> 400 INVALID_SCHEDULE_CONFIG, 메시지에 필드명 포함")
        void create_invalidConfig() throws Exception {
            // given
            given(scheduleService.create(any(CreateDepartmentScheduleRequest.class), eq(100L)))
                    .willThrow(new ScheduleConfigurationException("dates[0].day_of_month", "1~31 사이여야 합니다. 입력값: 32"));

            // when, then
            mockMvc.perform(post(BASE_URL)
                            .header(DepartmentScheduleSwagger.USER_ID_HEADER, 100L)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_CREATE_BODY))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.status").value("INVALID_SCHEDULE_CONFIG_400"))
                    .andExpect(jsonPath("$.message").value(containsString("dates[0].day_of_month")));
        }
    }

    @Nested
    @DisplayName("상태 변경 / 삭제 / 구간 조회")
    class OtherEndpointsTest {

        @Test
        @DisplayName("성공 : PATCH /{id}/status")
        void changeStatus_success() throws Exception {
            // given
            given(scheduleService.changeStatus(eq(1L), any())).willReturn(response());

            // when, then
            mockMvc.perform(patch(BASE_URL + "/1/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\": \"INACTIVE\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("DEPARTMENT_SCHEDULE_STATUS_CHANGE_SUCCESS_200"));
        }

        @Test
        @DisplayName("예외 : 상태 누락 -> 400")
        void changeStatus_missingStatus() throws Exception {
            mockMvc.perform(patch(BASE_URL + "/1/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("변경할 상태는 필수입니다."));
        }

        @Test
        @DisplayName("예외 : 없는 스케줄 삭제 -> 404")
        void delete_notFound() throws Exception {
            // given
            willThrow(new DepartmentScheduleNotFoundException(99L)).given(scheduleService).delete(99L);

            // when, then
            mockMvc.perform(delete(BASE_URL + "/99"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.status").value("DEPARTMENT_SCHEDULE_NOT_FOUND_404"));
        }

        @Test
        @DisplayName("성공 : GET /{id}/window, 시작 전 값은 생략")
        void getWindow_success() throws Exception {
            // given
            LocalDateTime now = LocalDateTime.of(2024, 5, 15, 10, 0);
            ScheduleWindow window = new ScheduleWindow(now.minusHours(2), now.plusHours(1));
            given(scheduleService.getWindow(1L))
                    .willReturn(ScheduleWindowResponse.of(1L, ScheduleWindowDetails.of(window, now)));

            // when, then
            mockMvc.perform(get(BASE_URL + "/1/window"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.activeNow").value(true))
                    .andExpect(jsonPath("$.data.timeUntilEndMs").value(3_600_000))
                    .andExpect(jsonPath("$.data.timeUntilStartMs").doesNotExist());
        }
    }
}
