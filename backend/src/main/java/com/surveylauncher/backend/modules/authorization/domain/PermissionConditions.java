package com.surveylauncher.backend.modules.authorization.domain;

import java.time.DayOfWeek;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 권한 행에 붙는 추가 제약. 비어 있는 항목은 제약하지 않는다.
 *
 * @param timeWindow  UTC 기준 하루 중 분 단위 허용 구간(양 끝 포함)
 * @param allowedDays 허용 요일
 * @param allowedIps  허용 IP. 지정되면 요청 컨텍스트에 IP가 있어야 한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PermissionConditions(
        TimeWindow timeWindow,
        List<DayOfWeek> allowedDays,
        @JsonAlias("allowedIPs") List<String> allowedIps
) {

    public PermissionConditions {
        allowedDays = allowedDays == null ? List.of() : List.copyOf(allowedDays);
        allowedIps = allowedIps == null ? List.of() : List.copyOf(allowedIps);
    }

    public boolean hasNoConstraints() {
        return timeWindow == null && allowedDays.isEmpty() && allowedIps.isEmpty();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimeWindow(Integer start, Integer end) {

        public static final int FIRST_MINUTE = 0;
        public static final int LAST_MINUTE = 24 * 60 - 1;

        public boolean contains(int minuteOfDay) {
            int from = start == null ? FIRST_MINUTE : start;
            int to = end == null ? LAST_MINUTE : end;
            return minuteOfDay >= from && minuteOfDay <= to;
        }
    }
}
