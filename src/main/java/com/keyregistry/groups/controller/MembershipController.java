package com.keyregistry.groups.controller;

import com.keyregistry.groups.dto.*;
import com.keyregistry.groups.service.MembershipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.time.Instant;
import java.util.List;

/**
 * REST controller for joining, leaving and managing group members.
 */
@RestController
@RequestMapping("/groups/{groupId}")
@Validated
@Tag(name = "Members", description = "Group membership lifecycle")
@SecurityRequirement(name = "Bearer Authentication")
public class MembershipController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(MembershipController.class);

    private final MembershipService membershipService;

    @Autowired
    public MembershipController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @PostMapping("/join")
    @Operation(summary = "Join a group",
               description = "Joins as MEMBER. Fails only when the group is full or the caller is already a member.")
    public ResponseEntity<GroupMemberDTO> join(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Valid @RequestBody JoinGroupRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} joining group {}", userId, groupId);

        GroupMemberDTO member = membershipService.join(groupId, request.getEncryptedGroupKey(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }

    @PostMapping("/members")
    @Operation(summary = "Invite a member directly",
               description = "Adds another identity to the group. Requires a moderator, an admin or the owner.")
    public ResponseEntity<GroupMemberDTO> invite(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Valid @RequestBody InviteMemberRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} inviting {} to group {}", userId, request.getMemberId(), groupId);

        GroupMemberDTO member = membershipService.invite(groupId, request.getMemberId(),
                request.getEncryptedGroupKey(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }

    @GetMapping("/members")
    @Operation(summary = "List group members")
    public ResponseEntity<List<GroupMemberDTO>> getMembers(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(membershipService.getMembers(groupId, userId));
    }

    @GetMapping("/members/{memberId}")
    @Operation(summary = "Get one membership")
    public ResponseEntity<GroupMemberDTO> getMembership(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Parameter(description = "Member identity") @PathVariable String memberId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(membershipService.getMembership(groupId, memberId, userId));
    }

    @PostMapping("/leave")
    @Operation(summary = "Leave a group", description = "The owner cannot leave.")
    public ResponseEntity<Void> leave(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} leaving group {}", userId, groupId);

        membershipService.leave(groupId, userId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/members/{memberId}")
    @Operation(summary = "Kick a member", description = "Requires KICK and a higher role than the target, unless the caller is the owner.")
    public ResponseEntity<Void> kick(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @PathVariable String memberId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} kicking {} from group {}", userId, memberId, groupId);

        membershipService.kick(groupId, memberId, userId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/members/{memberId}/role")
    @Operation(summary = "Change a member's role",
               description = "Owner or admin only. Only the owner may grant ADMIN; nobody may grant OWNER.")
    public ResponseEntity<GroupMemberDTO> updateRole(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @PathVariable String memberId,
            @Valid @RequestBody UpdateRoleRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} setting role of {} in group {} to {}", userId, memberId, groupId, request.getRole());

        return ResponseEntity.ok(membershipService.updateRole(groupId, memberId, request.getRole(), userId));
    }

    @PutMapping("/read-marker")
    @Operation(summary = "Advance the caller's read marker",
               description = "readAt is epoch seconds; omitted means now. The marker never moves backwards.")
    public ResponseEntity<GroupMemberDTO> markRead(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Valid @RequestBody(required = false) MarkReadRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        Instant readAt = request != null && request.getReadAt() != null
                ? Instant.ofEpochSecond(request.getReadAt())
                : null;

        return ResponseEntity.ok(membershipService.markRead(groupId, readAt, userId));
    }
}
