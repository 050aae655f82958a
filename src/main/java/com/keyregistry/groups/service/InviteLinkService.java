package com.keyregistry.groups.service;

import com.keyregistry.groups.dto.CreateInviteLinkRequest;
import com.keyregistry.groups.dto.InviteLinkDTO;

import java.util.List;

/**
 * Service interface for invite link management. Redemption lives in {@link MembershipService}.
 */
public interface InviteLinkService {

    /**
     * Create a link. When the request carries no code, a fresh one is generated.
     */
    InviteLinkDTO createInviteLink(String groupId, CreateInviteLinkRequest request, String creatorId);

    /**
     * Deactivate a link permanently. Revoking an already revoked link succeeds.
     */
    InviteLinkDTO revokeInviteLink(String groupId, String inviteCode, String requestingUserId);

    List<InviteLinkDTO> listInviteLinks(String groupId, String requestingUserId);

    /**
     * Read a single link, for previews before joining.
     */
    InviteLinkDTO getInviteLink(String groupId, String inviteCode);
}
