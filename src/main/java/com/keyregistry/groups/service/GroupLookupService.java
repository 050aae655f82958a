package com.keyregistry.groups.service;

import com.keyregistry.groups.dto.GroupDTO;

public interface GroupLookupService {

    /**
     * Resolve a public code (case-insensitive) to its group. No authorization required.
     */
    GroupDTO resolveByCode(String code);
}
