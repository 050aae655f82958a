package com.keyregistry.groups.controller;

import com.keyregistry.groups.dto.CreateInviteLinkRequest;
import com.keyregistry.groups.dto.GroupMemberDTO;
import com.keyregistry.groups.dto.InviteLinkDTO;
import com.keyregistry.groups.dto.JoinGroupRequest;
import com.keyregistry.groups.service.InviteLinkService;
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
import java.util.List;

@RestController
@RequestMapping("/groups/{groupId}/invite-links")
@Validated
@Tag(name = "Invite links", description = "Shareable invite links for groups")
@SecurityRequirement(name = "Bearer Authentication")
public class InviteLinkController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(InviteLinkController.class);

    private final InviteLinkService inviteLinkService;
    private final MembershipService membershipService;

    @Autowired
    public InviteLinkController(InviteLinkService inviteLinkService, MembershipService membershipService) {
        this.inviteLinkService = inviteLinkService;
        this.membershipService = membershipService;
    }

    @PostMapping
    @Operation(summary = "Create an invite link",
               description = "A code is generated when none is supplied. expiresAt is epoch seconds, 0 for never; maxUses 0 is unlimited.")
    public ResponseEntity<InviteLinkDTO> createInviteLink(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Valid @RequestBody(required = false) CreateInviteLinkRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        CreateInviteLinkRequest body = request != null ? request : new CreateInviteLinkRequest();

        InviteLinkDTO link = inviteLinkService.createInviteLink(groupId, body, userId);
        logger.info("User {} created invite link {} for group {}", userId, link.getInviteCode(), groupId);

        return ResponseEntity.status(HttpStatus.CREATED).body(link);
    }

    @GetMapping
    @Operation(summary = "List a group's invite links")
    public ResponseEntity<List<InviteLinkDTO>> listInviteLinks(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(inviteLinkService.listInviteLinks(groupId, userId));
    }

    @GetMapping("/{code}")
    @Operation(summary = "Preview an invite link")
    public ResponseEntity<InviteLinkDTO> getInviteLink(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Parameter(description = "Invite code") @PathVariable String code,
            HttpServletRequest httpRequest) {

        extractUserId(httpRequest);
        return ResponseEntity.ok(inviteLinkService.getInviteLink(groupId, code));
    }

    @DeleteMapping("/{code}")
    @Operation(summary = "Revoke an invite link", description = "Staff or the link's creator. Revoking twice succeeds.")
    public ResponseEntity<InviteLinkDTO> revokeInviteLink(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @PathVariable String code,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} revoking invite link {} of group {}", userId, code, groupId);

        return ResponseEntity.ok(inviteLinkService.revokeInviteLink(groupId, code, userId));
    }

    @PostMapping("/{code}/join")
    @Operation(summary = "Join through an invite link",
               description = "Works for invite-only groups. The link must be active, unexpired and not used up.")
    public ResponseEntity<GroupMemberDTO> joinWithInviteLink(
            @PathVariable @Pattern(regexp = GroupController.GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @PathVariable String code,
            @Valid @RequestBody JoinGroupRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} joining group {} with invite link {}", userId, groupId, code);

        GroupMemberDTO member = membershipService.joinWithInviteLink(groupId, code,
                request.getEncryptedGroupKey(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }
}
