package com.surveylauncher.backend.modules.authorization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.UserRoleAssignment;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.UserRoleAssignmentRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사용자의 현재 유효한 역할 할당을 조회한다. 만료/비활성 할당과 비활성 역할은 제외된다.
 */
@Component
public class AssignmentResolver {

    private final UserRoleAssignmentRepository assignmentRepository;
    private final Clock clock;

    public AssignmentResolver(UserRoleAssignmentRepository assignmentRepository, Clock clock) {
        this.assignmentRepository = assignmentRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<UserRoleAssignment> resolveValidAssignments(UUID userId, AssignmentFilter filter) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        AssignmentFilter effectiveFilter = filter == null ? AssignmentFilter.none() : filter;
        return assignmentRepository.findValidAssignments(userId, now).stream()
                .filter(assignment -> assignment.isValidAt(now))
                .filter(effectiveFilter::accepts)
                .toList();
    }
}
