package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.dto.CreateGroupRequest;
import com.keyregistry.groups.dto.GroupDTO;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.repository.impl.InMemoryGroupRepository;
import com.keyregistry.groups.repository.impl.RegistryItemMapper;
import com.keyregistry.groups.service.GroupAuditLogger;
import com.keyregistry.groups.service.GroupAuthorizationPolicy;
import com.keyregistry.groups.util.MutableClock;
import com.keyregistry.groups.util.QueryPerformanceTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.function.Consumer;

import static com.keyregistry.groups.util.TestConstants.*;

/**
 * Wires the real services over the in-memory store so scenarios exercise every layer
 * below the controllers.
 */
abstract class InMemoryRegistryTestSupport {

    protected static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

    protected MutableClock clock;
    protected GroupRepository repository;
    protected GroupServiceImpl groupService;
    protected MembershipServiceImpl membershipService;
    protected InviteLinkServiceImpl inviteLinkService;
    protected GroupLookupServiceImpl lookupService;

    @BeforeEach
    void wireServices() {
        clock = new MutableClock(START);
        repository = new InMemoryGroupRepository(new RegistryItemMapper(),
            new QueryPerformanceTracker(new SimpleMeterRegistry()));
        GroupAuthorizationPolicy policy = new GroupAuthorizationPolicyImpl();
        GroupAuditLogger auditLogger = new GroupAuditLogger();

        groupService = new GroupServiceImpl(repository, policy, auditLogger, clock);
        membershipService = new MembershipServiceImpl(repository, policy, auditLogger, clock);
        inviteLinkService = new InviteLinkServiceImpl(repository, policy, auditLogger, clock);
        lookupService = new GroupLookupServiceImpl(repository);
    }

    protected GroupDTO createGroup(String groupId, Consumer<CreateGroupRequest> customizer) {
        CreateGroupRequest request = new CreateGroupRequest(groupId, "Book Club", groupKey());
        customizer.accept(request);
        return groupService.createGroup(request, OWNER_ID);
    }

    protected GroupDTO createGroup() {
        return createGroup(GROUP_ID, request -> { });
    }

    protected void joinAs(String userId) {
        membershipService.join(GROUP_ID, memberKey(), userId);
    }

    protected int memberCount() {
        return repository.findGroup(GROUP_ID).orElseThrow().getMemberCount();
    }
}
