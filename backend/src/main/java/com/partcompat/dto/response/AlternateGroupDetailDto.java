package com.partcompat.dto.response;

import java.util.List;

/**
 * An alternate group with its members, primary first then oldest first.
 */
public record AlternateGroupDetailDto(
    AlternateGroupDto group,
    List<AlternateGroupMemberDto> members
) {}
