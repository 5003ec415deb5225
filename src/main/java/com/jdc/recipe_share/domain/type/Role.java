package com.jdc.recipe_share.domain.type;

public enum Role {
    USER,
    ADMIN
}
