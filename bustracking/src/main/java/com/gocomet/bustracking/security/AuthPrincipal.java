package com.gocomet.bustracking.security;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class AuthPrincipal {

    private final String principalId;
    private final Role role;
    private final String name;
}
