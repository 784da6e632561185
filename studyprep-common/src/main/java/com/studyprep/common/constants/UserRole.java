package com.studyprep.common.constants;

public enum UserRole {
    STUDENT,
    ADMIN
}
