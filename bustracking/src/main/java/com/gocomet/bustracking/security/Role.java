package com.gocomet.bustracking.security;

public enum Role {
    STUDENT,
    DRIVER,
    MODERATOR,
    ADMIN
}
