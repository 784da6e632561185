package com.studyprep.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class AuthorInfo {

    public static final String DELETED_USER_NAME = "Deleted User";

    private UUID id;
    private String displayName;
    private boolean deleted;

    /**
     * Placeholder author for questions whose owner account no longer exists.
     */
    public static AuthorInfo deletedUser() {
        return AuthorInfo.builder()
            .id(null)
            .displayName(DELETED_USER_NAME)
            .deleted(true)
            .build();
    }
}
