package com.surveylauncher.backend.modules.authorization.application;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import com.surveylauncher.backend.modules.authorization.domain.PermissionConditions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionContext;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;

import org.springframework.stereotype.Component;

/**
 * 권한 행의 시간대/요일/IP 조건을 확인한다. 시각은 UTC 기준이다.
 */
@Component
public class PermissionConditionEvaluator {

    private final Clock clock;

    public PermissionConditionEvaluator(Clock clock) {
        this.clock = clock;
    }

    public List<PermissionGrant> satisfiedGrants(List<PermissionGrant> grants, PermissionContext context) {
        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        return grants.stream()
                .filter(grant -> isSatisfied(grant.conditions(), context, now))
                .toList();
    }

    boolean isSatisfied(PermissionConditions conditions, PermissionContext context, LocalDateTime now) {
        if (conditions == null || conditions.hasNoConstraints()) {
            return true;
        }
        if (conditions.timeWindow() != null) {
            int minuteOfDay = now.getHour() * 60 + now.getMinute();
            if (!conditions.timeWindow().contains(minuteOfDay)) {
                return false;
            }
        }
        if (!conditions.allowedDays().isEmpty() && !conditions.allowedDays().contains(now.getDayOfWeek())) {
            return false;
        }
        if (!conditions.allowedIps().isEmpty()) {
            String ipAddress = context == null ? null : context.ipAddress();
            return ipAddress != null && conditions.allowedIps().contains(ipAddress);
        }
        return true;
    }
}
