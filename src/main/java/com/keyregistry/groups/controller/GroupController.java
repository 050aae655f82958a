package com.keyregistry.groups.controller;

import com.keyregistry.groups.dto.*;
import com.keyregistry.groups.service.GroupLookupService;
import com.keyregistry.groups.service.GroupService;
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

/**
 * REST controller for group management operations.
 * Extends BaseController for consistent error handling and user extraction.
 */
@RestController
@RequestMapping("/groups")
@Validated
@Tag(name = "Groups", description = "Group creation, settings and discovery")
@SecurityRequirement(name = "Bearer Authentication")
public class GroupController extends BaseController {
    
    private static final Logger logger = LoggerFactory.getLogger(GroupController.class);

    static final String GROUP_ID_REGEX = "[0-9a-fA-F]{64}";
    
    private final GroupService groupService;
    private final GroupLookupService groupLookupService;
    private final MembershipService membershipService;
    
    @Autowired
    public GroupController(GroupService groupService, GroupLookupService groupLookupService,
                           MembershipService membershipService) {
        this.groupService = groupService;
        this.groupLookupService = groupLookupService;
        this.membershipService = membershipService;
    }
    
    @PostMapping
    @Operation(summary = "Create a group",
               description = "Creates a group under a caller-chosen 64-hex-character ID. The caller becomes its owner.")
    public ResponseEntity<GroupDTO> createGroup(
            @Valid @RequestBody CreateGroupRequest request,
            HttpServletRequest httpRequest) {
        
        String userId = extractUserId(httpRequest);
        logger.info("Creating group {} for user {}", request.getName(), userId);
        
        GroupDTO group = groupService.createGroup(request, userId);
        logger.info("Successfully created group {} with ID {}", group.getName(), group.getGroupId());
        
        return ResponseEntity.status(HttpStatus.CREATED).body(group);
    }
    
    @GetMapping
    @Operation(summary = "List the caller's groups")
    public ResponseEntity<List<GroupDTO>> getUserGroups(HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        
        List<GroupDTO> groups = groupService.getUserGroups(userId);
        logger.debug("Retrieved {} groups for user {}", groups.size(), userId);
        
        return ResponseEntity.ok(groups);
    }

    @GetMapping("/search")
    @Operation(summary = "Search public groups",
               description = "Returns public, searchable groups whose name contains the query, ignoring case.")
    public ResponseEntity<List<GroupDTO>> searchPublicGroups(
            @Parameter(description = "Name fragment; empty lists every discoverable group")
            @RequestParam(required = false, defaultValue = "") String query,
            HttpServletRequest httpRequest) {

        extractUserId(httpRequest);
        return ResponseEntity.ok(groupService.searchPublicGroups(query));
    }

    @GetMapping("/code/{code}")
    @Operation(summary = "Resolve a public code",
               description = "Looks up a group by its public code. Codes are matched case-insensitively.")
    public ResponseEntity<GroupDTO> resolveByCode(
            @Parameter(description = "Public group code") @PathVariable String code,
            HttpServletRequest httpRequest) {

        extractUserId(httpRequest);
        return ResponseEntity.ok(groupLookupService.resolveByCode(code));
    }

    @PostMapping("/code/{code}/join")
    @Operation(summary = "Join by public code",
               description = "Resolves the code and joins that group as MEMBER.")
    public ResponseEntity<GroupMemberDTO> joinByCode(
            @Parameter(description = "Public group code") @PathVariable String code,
            @Valid @RequestBody JoinGroupRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} joining group by code {}", userId, code);

        GroupMemberDTO member = membershipService.joinByCode(code, request.getEncryptedGroupKey(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }
    
    @GetMapping("/{groupId}")
    @Operation(summary = "Get group details", description = "Private groups are visible to members only.")
    public ResponseEntity<GroupDTO> getGroup(
            @Parameter(description = "Group ID") 
            @PathVariable @Pattern(regexp = GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {
        
        String userId = extractUserId(httpRequest);
        
        GroupDTO group = groupService.getGroup(groupId, userId);
        return ResponseEntity.ok(group);
    }

    @PatchMapping("/{groupId}")
    @Operation(summary = "Update group settings",
               description = "Partial update. Requires the owner or an admin.")
    public ResponseEntity<GroupDTO> updateGroupSettings(
            @PathVariable @Pattern(regexp = GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Valid @RequestBody UpdateGroupRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} updating settings of group {}", userId, groupId);

        return ResponseEntity.ok(groupService.updateGroupSettings(groupId, request, userId));
    }

    @PutMapping("/{groupId}/code")
    @Operation(summary = "Claim a public code", description = "Only the group owner may set the code. Codes are unique.")
    public ResponseEntity<GroupDTO> setGroupCode(
            @PathVariable @Pattern(regexp = GROUP_ID_REGEX, message = "Invalid group ID format") String groupId,
            @Valid @RequestBody SetGroupCodeRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} claiming code {} for group {}", userId, request.getCode(), groupId);

        return ResponseEntity.ok(groupService.setGroupCode(groupId, request.getCode(), userId));
    }
}
