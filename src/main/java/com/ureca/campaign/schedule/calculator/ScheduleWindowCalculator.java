package com.ureca.campaign.schedule.calculator;

import com.ureca.campaign.schedule.config.DailyDate;
import com.ureca.campaign.schedule.config.DailyDatesConfig;
import com.ureca.campaign.schedule.config.HourlySlot;
import com.ureca.campaign.schedule.config.HourlySlotsConfig;
import com.ureca.campaign.schedule.config.ScheduleConfig;
import com.ureca.campaign.schedule.entity.ScheduleType;
import com.ureca.campaign.schedule.exception.ScheduleComputationException;
import com.ureca.campaign.schedule.exception.ScheduleConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스케줄 설정을 실제 활성 구간으로 변환
 * <p>
 * DAILY_DATES : 가장 이른 날짜 08:00 ~ 가장 늦은 날짜 17:45
 * HOURLY_SLOTS : 이번 주 월요일 기준, 가장 이른 (요일, 시작) ~ 가장 늦은 (요일, 종료)
 * <p>
 * 연/월이 없는 날짜는 계산 시점의 연/월로 채움
 * 같은 설정이라도 계산 시점에 따라 구간이 달라지므로 결과를 캐시하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleWindowCalculator {

    public static final LocalTime DAILY_START_TIME = LocalTime.of(8, 0);
    public static final LocalTime DAILY_END_TIME = LocalTime.of(17, 45);

    private static final int MONDAY = 2;
    private static final int SATURDAY = 7;
    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::\\d{2})?$");

    private final Clock clock;

    public ScheduleWindow windowForDailyDates(DailyDatesConfig config) {
        List<DailyDate> dates = config.dates();
        if (dates == null || dates.isEmpty()) {
            throw new ScheduleConfigurationException("dates", "날짜가 비어 있습니다.");
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate earliest = null;
        LocalDate latest = null;

        for (int i = 0; i < dates.size(); i++) {
            LocalDate date = resolveDate(dates.get(i), i, today);
            if (earliest == null || date.isBefore(earliest)) {
                earliest = date;
            }
            if (latest == null || date.isAfter(latest)) {
                latest = date;
            }
        }

        return new ScheduleWindow(
                earliest.atTime(DAILY_START_TIME),
                latest.atTime(DAILY_END_TIME)
        );
    }

    public ScheduleWindow windowForHourlySlots(HourlySlotsConfig config) {
        List<HourlySlot> slots = config.slots();
        if (slots == null || slots.isEmpty()) {
            throw new ScheduleConfigurationException("slots", "시간대가 비어 있습니다.");
        }

        List<ParsedSlot> parsed = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            parsed.add(parseSlot(slots.get(i), i));
        }

        ParsedSlot earliest = parsed.stream()
                .min(Comparator.comparingInt(ParsedSlot::dayOfWeek).thenComparing(ParsedSlot::startTime))
                .orElseThrow();
        ParsedSlot latest = parsed.stream()
                .max(Comparator.comparingInt(ParsedSlot::dayOfWeek).thenComparing(ParsedSlot::endTime))
                .orElseThrow();

        LocalDate weekAnchor = currentWeekMonday();

        return new ScheduleWindow(
                weekAnchor.plusDays(earliest.dayOfWeek() - MONDAY).atTime(earliest.startTime()),
                weekAnchor.plusDays(latest.dayOfWeek() - MONDAY).atTime(latest.endTime())
        );
    }

    /**
     * 선언된 스케줄 타입으로 구간 계산
     * 설정 타입이 선언과 다르면 계산하지 않음
     */
    public ScheduleWindow windowFor(ScheduleConfig config, ScheduleType scheduleType) {
        if (config == null) {
            throw new ScheduleComputationException("스케줄 설정이 없습니다.");
        }
        if (scheduleType == null) {
            throw new ScheduleComputationException("스케줄 타입이 없습니다.");
        }

        return switch (scheduleType) {
            case DAILY_DATES -> {
                if (!(config instanceof DailyDatesConfig daily)) {
                    throw mismatch(config, scheduleType);
                }
                yield windowForDailyDates(daily);
            }
            case HOURLY_SLOTS -> {
                if (!(config instanceof HourlySlotsConfig hourly)) {
                    throw mismatch(config, scheduleType);
                }
                yield windowForHourlySlots(hourly);
            }
        };
    }

    /**
     * 주어진 시각이 활성 구간 안인지 확인
     * 계산 실패는 예외 대신 false (구간 밖으로 간주)
     */
    public boolean isWithin(ScheduleConfig config, ScheduleType scheduleType, LocalDateTime instant) {
        try {
            return windowFor(config, scheduleType).contains(instant);
        } catch (RuntimeException e) {
            log.debug("[스케줄 계산] 구간 계산 실패로 비활성 처리. type: {}, error: {}",
                    scheduleType, e.getMessage());
            return false;
        }
    }

    public ScheduleWindowDetails windowDetails(ScheduleConfig config, ScheduleType scheduleType) {
        ScheduleWindow window = windowFor(config, scheduleType);
        return ScheduleWindowDetails.of(window, now());
    }

    /**
     * 생성/수정 시 저장 전 검증
     * 선언 타입 일치 + 계산 규칙 (범위, HH:MM)
     * 종료가 시작보다 이른 시간대(자정을 넘기는 시간대)도 허용
     */
    public void validate(ScheduleConfig config, ScheduleType scheduleType) {
        if (config == null) {
            throw new ScheduleConfigurationException("schedule_config", "설정이 비어 있습니다.");
        }
        if (config.scheduleType() != scheduleType) {
            throw new ScheduleConfigurationException("schedule_config.type",
                    "schedule_type(" + scheduleType.getTypeName() + ")과 설정 타입("
                            + config.scheduleType().getTypeName() + ")이 다릅니다.");
        }

        windowFor(config, scheduleType);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // 해당 월에 없는 날짜(4월 31일 등)는 다음 달로 넘어감
    private LocalDate resolveDate(DailyDate date, int index, LocalDate today) {
        if (date == null) {
            throw new ScheduleConfigurationException("dates[" + index + "]", "날짜가 비어 있습니다.");
        }
        Integer day = date.dayOfMonth();
        if (day == null || day < 1 || day > 31) {
            throw new ScheduleConfigurationException("dates[" + index + "].day_of_month",
                    "1~31 사이여야 합니다. 입력값: " + day);
        }

        int month = date.month() != null ? date.month() : today.getMonthValue();
        if (month < 1 || month > 12) {
            throw new ScheduleConfigurationException("dates[" + index + "].month",
                    "1~12 사이여야 합니다. 입력값: " + month);
        }

        int year = date.year() != null ? date.year() : today.getYear();

        return LocalDate.of(year, month, 1).plusDays(day - 1L);
    }

    private ParsedSlot parseSlot(HourlySlot slot, int index) {
        String prefix = "slots[" + index + "]";
        if (slot == null) {
            throw new ScheduleConfigurationException(prefix, "시간대가 비어 있습니다.");
        }

        Integer dayOfWeek = slot.dayOfWeek();
        if (dayOfWeek == null) {
            throw new ScheduleConfigurationException(prefix + ".day_of_week", "요일이 없습니다.");
        }
        if (dayOfWeek < MONDAY || dayOfWeek > SATURDAY) {
            throw new ScheduleConfigurationException(prefix + ".day_of_week",
                    "2(월)~7(토) 사이여야 합니다. 입력값: " + dayOfWeek);
        }

        return new ParsedSlot(
                dayOfWeek,
                parseTime(slot.startTime(), prefix + ".start_time"),
                parseTime(slot.endTime(), prefix + ".end_time")
        );
    }

    private LocalTime parseTime(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ScheduleConfigurationException(field, "시간이 없습니다.");
        }

        Matcher matcher = TIME_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw new ScheduleConfigurationException(field, "HH:MM 형식이 아닙니다. 입력값: " + value);
        }

        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            throw new ScheduleConfigurationException(field, "범위를 벗어난 시간입니다. 입력값: " + value);
        }
        return LocalTime.of(hour, minute);
    }

    private LocalDate currentWeekMonday() {
        return LocalDate.now(clock).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    private ScheduleComputationException mismatch(ScheduleConfig config, ScheduleType scheduleType) {
        return new ScheduleComputationException(
                "설정 타입(" + config.scheduleType().getTypeName() + ")이 스케줄 타입("
                        + scheduleType.getTypeName() + ")과 다릅니다.");
    }

    private record ParsedSlot(int dayOfWeek, LocalTime startTime, LocalTime endTime) {
    }
}
