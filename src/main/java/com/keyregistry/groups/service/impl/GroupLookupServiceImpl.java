package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.dto.GroupDTO;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.service.GroupLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Read-only resolution of public codes. Two point reads: the code lookup, then the group.
 */
@Service
public class GroupLookupServiceImpl implements GroupLookupService {

    private static final Logger logger = LoggerFactory.getLogger(GroupLookupServiceImpl.class);

    private final GroupRepository groupRepository;

    @Autowired
    public GroupLookupServiceImpl(GroupRepository groupRepository) {
        this.groupRepository = groupRepository;
    }

    @Override
    public GroupDTO resolveByCode(String code) {
        Group group = GroupRecords.requireGroupByCode(groupRepository, code);

        logger.debug("Resolved code '{}' to group {}", code, group.getGroupId());
        return new GroupDTO(group, null);
    }
}
